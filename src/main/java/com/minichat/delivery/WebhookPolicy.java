package com.minichat.delivery;

/**
 * webhook 与在线推送的关系。
 */
public enum WebhookPolicy {
    /** 在线推送与 webhook 各自独立尝试。 */
    ALWAYS,
    /** 目标没有任何在线连接时才走 webhook。 */
    WHEN_OFFLINE
}
