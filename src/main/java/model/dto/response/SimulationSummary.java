package model.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 仿真概要
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.ALWAYS)
public class SimulationSummary {
    private String id;          // 目录名
    private String name;        // 目录名中第一个 '-' 之前的部分
    private Instant startTime;  // 最早分段首行的时间戳，读不到时为 null
    private long eventCount;    // 所有分段的非空行数
}
