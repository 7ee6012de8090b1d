package model.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import engine.SimEvent;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 分页后的事件查询结果
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EventPage {
    private List<SimEvent> events;
    private int total;        // 过滤后、分页前的总数
    private boolean hasMore;  // 本页之后是否还有数据

    public static EventPage empty() {
        return new EventPage(List.of(), 0, false);
    }
}
