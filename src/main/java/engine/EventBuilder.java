package engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.f4b6a3.ulid.UlidCreator;
import common.config.JacksonConfig;
import common.consts.ErrorCodes;
import common.consts.EventTypeEnum;
import common.exception.BusinessException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 事件构造器
 * 每种事件一个工厂方法，调用时生成 eventId 与 timestamp；只做必填字段检查，不做任何 I/O
 */
public final class EventBuilder {

    private static final int MAX_DESCRIPTION_LENGTH = 500;

    private static final ObjectMapper WIRE_MAPPER = JacksonConfig.eventObjectMapper();

    private EventBuilder() {}

    /**
     * 里程碑事件：回合开始/结束、仿真开始/结束等
     */
    public static SimEvent milestone(String simulationId, int turnNumber, String milestoneType,
                                     String description, List<String> causedBy) {
        requireText(milestoneType, "milestone_type");
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("milestone_type", milestoneType);
        return envelope(EventTypeEnum.MILESTONE, simulationId, turnNumber, null, description, causedBy, details);
    }

    /**
     * 决策事件，oldValue/newValue 为空时不写入 details
     */
    public static SimEvent decision(String simulationId, int turnNumber, String agentId, String decisionType,
                                    Object oldValue, Object newValue,
                                    String description, List<String> causedBy) {
        requireText(agentId, "agent_id");
        requireText(decisionType, "decision_type");
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("decision_type", decisionType);
        if (oldValue != null) {
            details.put("old_value", oldValue);
        }
        if (newValue != null) {
            details.put("new_value", newValue);
        }
        return envelope(EventTypeEnum.DECISION, simulationId, turnNumber, agentId, description, causedBy, details);
    }

    /**
     * 动作事件
     */
    public static SimEvent action(String simulationId, int turnNumber, String agentId, String actionType,
                                  Map<String, Object> actionPayload,
                                  String description, List<String> causedBy) {
        requireText(agentId, "agent_id");
        requireText(actionType, "action_type");
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("action_type", actionType);
        details.put("action_payload", actionPayload == null ? Map.of() : actionPayload);
        return envelope(EventTypeEnum.ACTION, simulationId, turnNumber, agentId, description, causedBy, details);
    }

    /**
     * 状态变量变化事件，scope 为空时视为 global
     */
    public static SimEvent state(String simulationId, int turnNumber, String variableName,
                                 Object oldValue, Object newValue, String agentId, String scope,
                                 String description, List<String> causedBy) {
        requireText(variableName, "variable_name");
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("variable_name", variableName);
        details.put("old_value", oldValue);
        details.put("new_value", newValue);
        details.put("scope", scope == null ? "global" : scope);
        return envelope(EventTypeEnum.STATE, simulationId, turnNumber, agentId, description, causedBy, details);
    }

    /**
     * 计算细节事件
     */
    public static SimEvent detail(String simulationId, int turnNumber, String calculationType,
                                  Map<String, Object> intermediateValues,
                                  String description, List<String> causedBy) {
        requireText(calculationType, "calculation_type");
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("calculation_type", calculationType);
        details.put("intermediate_values", intermediateValues == null ? Map.of() : intermediateValues);
        return envelope(EventTypeEnum.DETAIL, simulationId, turnNumber, null, description, causedBy, details);
    }

    /**
     * 系统事件：status 取 success/failure/retry/warning 等，extraDetails 原样并入 details
     */
    public static SimEvent system(String simulationId, int turnNumber, String status,
                                  String errorType, Integer retryCount, Map<String, Object> extraDetails,
                                  String description, List<String> causedBy) {
        requireText(status, "status");
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("status", status);
        if (errorType != null && !errorType.isEmpty()) {
            details.put("error_type", errorType);
        }
        if (retryCount != null) {
            details.put("retry_count", retryCount);
        }
        if (extraDetails != null) {
            details.putAll(extraDetails);
        }
        return envelope(EventTypeEnum.SYSTEM, simulationId, turnNumber, null, description, causedBy, details);
    }

    private static SimEvent envelope(EventTypeEnum type, String simulationId, int turnNumber, String agentId,
                                     String description, List<String> causedBy, Map<String, Object> details) {
        requireText(simulationId, "simulation_id");
        if (turnNumber < 0) {
            throw new BusinessException(ErrorCodes.MISSING_FIELD + ": turn_number 不能为负数 (" + turnNumber + ")");
        }
        if (description != null && description.length() > MAX_DESCRIPTION_LENGTH) {
            throw new BusinessException(ErrorCodes.DESCRIPTION_TOO_LONG);
        }

        SimEvent event = new SimEvent();
        event.setEventId(UlidCreator.getMonotonicUlid().toString());
        event.setTimestamp(Instant.now());
        event.setTurnNumber(turnNumber);
        event.setSimulationId(simulationId);
        event.setEventType(type);
        event.setAgentId(agentId);
        event.setDescription(description);
        event.setCausedBy(causedBy);
        event.setDetails(details);
        return toWireForm(event);
    }

    /**
     * 按落盘格式过一遍序列化，details 中的值统一为 JSON 原生类型
     * (Long/Float/BigDecimal/POJO 等解析回来会变成 Integer/Double/Map)，保证构造结果与解析结果相等
     */
    private static SimEvent toWireForm(SimEvent event) {
        try {
            return WIRE_MAPPER.readValue(WIRE_MAPPER.writeValueAsString(event), SimEvent.class);
        } catch (JsonProcessingException e) {
            throw new BusinessException(ErrorCodes.DETAILS_NOT_SERIALIZABLE + ": " + e.getOriginalMessage(), e);
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new BusinessException(ErrorCodes.MISSING_FIELD + ": " + field);
        }
    }
}
