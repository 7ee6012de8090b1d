package engine;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import common.consts.EventTypeEnum;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 仿真事件信封
 * 六种事件共用同一结构，以 eventType 区分，差异字段全部放在 details 中。
 * 每行 JSONL 即一个 SimEvent，字段名为 snake_case，null 字段也照常输出。
 */
@Data
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(value = JsonInclude.Include.ALWAYS, content = JsonInclude.Include.ALWAYS)
public class SimEvent implements Comparable<SimEvent> {
    private String eventId;                 // 时间有序的唯一标识 (ULID)
    private Instant timestamp;              // 构造时刻 (UTC)
    private int turnNumber;                 // 所属回合
    private String simulationId;            // 所属仿真
    private EventTypeEnum eventType;        // 事件类型
    private String agentId;                 // 智能体ID，可空
    private String description;             // 可读描述，可空
    private List<String> causedBy = new ArrayList<>();          // 直接上游事件ID，有序
    private Map<String, Object> details = new LinkedHashMap<>(); // 事件负载

    public void setCausedBy(List<String> causedBy) {
        this.causedBy = new ArrayList<>();
        if (causedBy != null) {
            causedBy.stream().filter(Objects::nonNull).forEach(this.causedBy::add);
        }
    }

    public void setDetails(Map<String, Object> details) {
        this.details = details == null ? new LinkedHashMap<>() : new LinkedHashMap<>(details);
    }

    /**
     * 读取 details 中的字段
     */
    public Object getDetail(String key) {
        return details.get(key);
    }

    /**
     * 读取 details 中的字符串字段
     */
    public String getDetailAsString(String key) {
        Object value = details.get(key);
        return value == null ? null : value.toString();
    }

    @JsonIgnore
    public String getMilestoneType() {
        return getDetailAsString("milestone_type");
    }

    @JsonIgnore
    public String getDecisionType() {
        return getDetailAsString("decision_type");
    }

    @JsonIgnore
    public String getActionType() {
        return getDetailAsString("action_type");
    }

    @JsonIgnore
    public String getVariableName() {
        return getDetailAsString("variable_name");
    }

    @JsonIgnore
    public String getStatus() {
        return getDetailAsString("status");
    }

    /**
     * 信封是否完整：读取历史文件时，缺少这些字段的行视为损坏
     */
    @JsonIgnore
    public boolean isEnvelopeComplete() {
        return eventId != null && timestamp != null && eventType != null;
    }

    @Override
    public int compareTo(SimEvent other) {
        //  按时间早晚排
        int timeCompare = timestamp.compareTo(other.timestamp);
        if (timeCompare != 0) {
            return timeCompare;
        }
        //  时间相同 按事件ID排 保证与文件顺序无关的确定性全序
        return eventId.compareTo(other.eventId);
    }
}
