package com.minichat.common.time;

import com.minichat.common.error.ValidationException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * 时间约定：库里存 UTC 的 LocalDateTime（毫秒精度），对外统一输出 ISO-8601 Instant。
 */
public final class Timestamps {

    public static final String INVALID_SINCE = "Invalid timestamp format. Use ISO 8601 format.";

    private Timestamps() {
    }

    public static LocalDateTime nowUtc(Clock clock) {
        return LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC).truncatedTo(ChronoUnit.MILLIS);
    }

    public static String format(LocalDateTime utc) {
        if (utc == null) {
            return null;
        }
        return utc.toInstant(ZoneOffset.UTC).toString();
    }

    /**
     * 解析 since 参数。带时区（...Z / +08:00）的先换算到 UTC；不带时区的按 UTC 理解。
     *
     * @return null 表示不过滤
     */
    public static LocalDateTime parseSince(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String s = raw.trim();
        LocalDateTime parsed = parseOffset(s);
        if (parsed == null) {
            parsed = parseLocal(s);
        }
        if (parsed == null) {
            throw new ValidationException(INVALID_SINCE);
        }
        return parsed;
    }

    private static LocalDateTime parseOffset(String s) {
        try {
            return LocalDateTime.ofInstant(OffsetDateTime.parse(s).toInstant(), ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static LocalDateTime parseLocal(String s) {
        try {
            return LocalDateTime.parse(s);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
