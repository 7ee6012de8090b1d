package service.event;

import model.dto.request.EventFilter;
import model.dto.response.CausalityChain;
import model.dto.response.CausalityReport;
import model.dto.response.EventPage;
import model.dto.response.SimulationSummary;
import engine.SimEvent;

import java.util.List;
import java.util.Optional;

/**
 * 仿真事件查询服务
 * 每次调用都重新扫描输出目录，不做缓存；可以与正在写入的写入器并发运行。
 * 文件或行的损坏只会让结果变少，不会抛出异常。
 */
public interface EventService {

    /**
     * 列出输出根目录下所有带事件分段的仿真
     */
    List<SimulationSummary> listSimulations();

    /**
     * 聚合所有分段，过滤后按 (timestamp, event_id) 升序排序并分页
     * @throws common.exception.BusinessException 查询条件非法时抛出
     */
    EventPage getFilteredEvents(String simulationId, EventFilter filter);

    /**
     * 按ID查找事件，ID重复时以第一次出现的为准
     */
    Optional<SimEvent> getEventById(String simulationId, String eventId);

    /**
     * 查询因果链：upstream 为 depth 跳以内的祖先，downstream 为直接子事件
     * @return 目标事件不存在时为空
     */
    Optional<CausalityChain> getCausalityChain(String simulationId, String eventId, int depth);

    /**
     * 检查 caused_by 引用的完整性
     */
    CausalityReport verifyCausality(String simulationId);
}
