package model.dto.request;

import common.consts.ErrorCodes;
import common.consts.EventTypeEnum;
import common.exception.BusinessException;
import engine.SimEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * 事件查询条件
 * 所有条件可空，空表示不过滤；时间与回合区间均为闭区间
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventFilter {

    public static final int DEFAULT_LIMIT = 1000;
    public static final int MAX_LIMIT = 10_000;

    private List<EventTypeEnum> eventTypes;
    private List<String> agentIds;
    private Integer turnStart;
    private Integer turnEnd;
    private Instant startTimestamp;
    private Instant endTimestamp;

    @Builder.Default
    private int limit = DEFAULT_LIMIT;

    @Builder.Default
    private int offset = 0;

    /**
     * 校验调用方给出的条件，非法时抛出业务异常
     */
    public void validate() {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new BusinessException(ErrorCodes.INVALID_FILTER + ": limit 需在 1~" + MAX_LIMIT + " 之间");
        }
        if (offset < 0) {
            throw new BusinessException(ErrorCodes.INVALID_FILTER + ": offset 不能为负数");
        }
        if ((turnStart != null && turnStart < 0) || (turnEnd != null && turnEnd < 0)) {
            throw new BusinessException(ErrorCodes.INVALID_FILTER + ": 回合号不能为负数");
        }
        if (turnStart != null && turnEnd != null && turnStart > turnEnd) {
            throw new BusinessException(ErrorCodes.INVALID_FILTER + ": turn_start 大于 turn_end");
        }
        if (startTimestamp != null && endTimestamp != null && startTimestamp.isAfter(endTimestamp)) {
            throw new BusinessException(ErrorCodes.INVALID_FILTER + ": start_timestamp 晚于 end_timestamp");
        }
    }

    /**
     * 事件是否满足所有非空条件
     */
    public boolean matches(SimEvent event) {
        if (startTimestamp != null && event.getTimestamp().isBefore(startTimestamp)) {
            return false;
        }
        if (endTimestamp != null && event.getTimestamp().isAfter(endTimestamp)) {
            return false;
        }
        if (eventTypes != null && !eventTypes.isEmpty() && !eventTypes.contains(event.getEventType())) {
            return false;
        }
        if (agentIds != null && !agentIds.isEmpty() && !agentIds.contains(event.getAgentId())) {
            return false;
        }
        if (turnStart != null && event.getTurnNumber() < turnStart) {
            return false;
        }
        return turnEnd == null || event.getTurnNumber() <= turnEnd;
    }
}
