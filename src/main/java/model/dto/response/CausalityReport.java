package model.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 因果引用完整性检查结果
 * 写入端不做校验，这些问题都属于生产方的缺陷，由读取端事后发现
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CausalityReport {
    private String simulationId;
    private int eventCount;
    private List<Violation> danglingReferences = new ArrayList<>();  // 引用的父事件不存在
    private List<Violation> temporalViolations = new ArrayList<>();  // 父事件时间晚于子事件
    private List<String> duplicateEventIds = new ArrayList<>();      // 重复的事件ID
    private List<String> cyclicEventIds = new ArrayList<>();         // 位于因果环上的事件

    public boolean isClean() {
        return danglingReferences.isEmpty() && temporalViolations.isEmpty()
                && duplicateEventIds.isEmpty() && cyclicEventIds.isEmpty();
    }

    /**
     * 一条有问题的 child -> parent 引用
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Violation {
        private String eventId;
        private String parentId;
    }
}
