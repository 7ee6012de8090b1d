package engine;

import common.consts.EventTypeEnum;
import common.consts.VerbosityLevel;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * 详细程度过滤策略
 * 每种事件类型对应一个最低等级，当前等级不低于它时才持久化。SYSTEM 事件按 DETAIL 处理。
 */
public final class VerbosityPolicy {

    private static final Map<EventTypeEnum, VerbosityLevel> MINIMUM_LEVEL;

    static {
        Map<EventTypeEnum, VerbosityLevel> table = new EnumMap<>(EventTypeEnum.class);
        table.put(EventTypeEnum.MILESTONE, VerbosityLevel.MILESTONE);
        table.put(EventTypeEnum.DECISION, VerbosityLevel.DECISION);
        table.put(EventTypeEnum.ACTION, VerbosityLevel.ACTION);
        table.put(EventTypeEnum.STATE, VerbosityLevel.STATE);
        table.put(EventTypeEnum.DETAIL, VerbosityLevel.DETAIL);
        table.put(EventTypeEnum.SYSTEM, VerbosityLevel.DETAIL);
        MINIMUM_LEVEL = Collections.unmodifiableMap(table);
    }

    private VerbosityPolicy() {}

    public static VerbosityLevel minimumFor(EventTypeEnum eventType) {
        return MINIMUM_LEVEL.get(Objects.requireNonNull(eventType, "eventType"));
    }

    public static boolean shouldLog(EventTypeEnum eventType, VerbosityLevel verbosity) {
        Objects.requireNonNull(verbosity, "verbosity");
        return verbosity.isAtLeast(minimumFor(eventType));
    }
}
