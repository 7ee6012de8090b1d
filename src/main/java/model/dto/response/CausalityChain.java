package model.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import engine.SimEvent;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 因果链：upstream 为 depth 跳以内的全部祖先，downstream 只含直接子事件
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CausalityChain {
    private String eventId;
    private SimEvent event;
    private List<SimEvent> upstream;
    private List<SimEvent> downstream;
}
