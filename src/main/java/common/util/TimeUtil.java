package common.util;

import common.consts.ErrorCodes;
import common.exception.BusinessException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * 事件时间戳工具
 * 分段文件名中的时间戳与查询参数中的时间戳都在这里统一处理，一律按 UTC
 */
public final class TimeUtil {

    /**
     * 滚动分段文件名时间戳，精确到微秒：2024-01-31_23-59-59-123456
     */
    public static final DateTimeFormatter SEGMENT_STAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss-SSSSSS").withZone(ZoneOffset.UTC);

    private TimeUtil() {}

    public static String formatSegmentStamp(Instant instant) {
        return SEGMENT_STAMP.format(instant);
    }

    /**
     * 解析 ISO-8601 时间戳
     * 支持 Z / 偏移量后缀；不带偏移量的本地时间按 UTC 处理
     */
    public static Instant parseTimestamp(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(text.trim(), OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return ((OffsetDateTime) parsed).toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new BusinessException(ErrorCodes.INVALID_TIMESTAMP + ": " + text, e);
        }
    }
}
