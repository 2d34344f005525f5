package com.minichat.domain.dto;

import java.util.List;

public record MessagePage(List<MessageView> messages, Pagination pagination) {
}
