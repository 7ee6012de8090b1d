package controller;

import common.Result;
import common.config.EventStreamConfig;
import common.consts.ErrorCodes;
import common.consts.EventTypeEnum;
import common.exception.BusinessException;
import common.util.TimeUtil;
import model.dto.request.EventFilter;
import model.dto.response.CausalityReport;
import model.dto.response.EventPage;
import model.dto.response.SimulationSummary;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import service.event.EventService;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 仿真事件流查询接口
 */
@RestController
@RequestMapping("/simulations")
public class SimEventController {

    private static final int MAX_DEPTH = 20;

    private final EventService eventService;
    private final EventStreamConfig config;

    public SimEventController(EventService eventService, EventStreamConfig config) {
        this.eventService = eventService;
        this.config = config;
    }

    /**
     * 列出所有带事件流的仿真
     */
    @GetMapping
    public Result listSimulations() {
        List<SimulationSummary> simulations = eventService.listSimulations();
        return Result.success("查询成功", simulations);
    }

    /**
     * 过滤 + 分页查询事件
     */
    @GetMapping("/{simulationId}/events")
    public Result listEvents(@PathVariable("simulationId") String simulationId,
                             @RequestParam(name = "event_types", required = false) List<String> eventTypes,
                             @RequestParam(name = "agent_ids", required = false) List<String> agentIds,
                             @RequestParam(name = "turn_start", required = false) Integer turnStart,
                             @RequestParam(name = "turn_end", required = false) Integer turnEnd,
                             @RequestParam(name = "start_timestamp", required = false) String startTimestamp,
                             @RequestParam(name = "end_timestamp", required = false) String endTimestamp,
                             @RequestParam(name = "limit", defaultValue = "1000") int limit,
                             @RequestParam(name = "offset", defaultValue = "0") int offset) {
        EventFilter filter = EventFilter.builder()
                .eventTypes(parseEventTypes(eventTypes))
                .agentIds(agentIds)
                .turnStart(turnStart)
                .turnEnd(turnEnd)
                .startTimestamp(TimeUtil.parseTimestamp(startTimestamp))
                .endTimestamp(TimeUtil.parseTimestamp(endTimestamp))
                .limit(limit)
                .offset(offset)
                .build();
        EventPage page = eventService.getFilteredEvents(simulationId, filter);
        return Result.success("查询成功", page);
    }

    /**
     * 按ID查询单个事件
     */
    @GetMapping("/{simulationId}/events/{eventId}")
    public Result getEvent(@PathVariable("simulationId") String simulationId, @PathVariable("eventId") String eventId) {
        return eventService.getEventById(simulationId, eventId)
                .map(event -> Result.success("查询成功", event))
                .orElseGet(() -> Result.notFound(notFoundMessage(simulationId, eventId)));
    }

    /**
     * 查询事件的因果链
     */
    @GetMapping("/{simulationId}/causality/{eventId}")
    public Result getCausalityChain(@PathVariable("simulationId") String simulationId, @PathVariable("eventId") String eventId,
                                    @RequestParam(name = "depth", required = false) Integer depth) {
        int effectiveDepth = depth == null ? config.getDefaultCausalityDepth() : depth;
        if (effectiveDepth < 1 || effectiveDepth > MAX_DEPTH) {
            throw new BusinessException(ErrorCodes.INVALID_DEPTH + ": 需在 1~" + MAX_DEPTH + " 之间");
        }
        return eventService.getCausalityChain(simulationId, eventId, effectiveDepth)
                .map(chain -> Result.success("查询成功", chain))
                .orElseGet(() -> Result.notFound(notFoundMessage(simulationId, eventId)));
    }

    /**
     * 检查因果引用完整性
     */
    @GetMapping("/{simulationId}/causality-report")
    public Result getCausalityReport(@PathVariable("simulationId") String simulationId) {
        CausalityReport report = eventService.verifyCausality(simulationId);
        return Result.success("查询成功", report);
    }

    private static List<EventTypeEnum> parseEventTypes(List<String> names) {
        if (names == null) {
            return null;
        }
        List<EventTypeEnum> types = new ArrayList<>();
        for (String name : names) {
            try {
                types.add(EventTypeEnum.valueOf(name.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new BusinessException(ErrorCodes.INVALID_EVENT_TYPE + ": " + name);
            }
        }
        return types;
    }

    private static String notFoundMessage(String simulationId, String eventId) {
        return ErrorCodes.EVENT_NOT_FOUND + ": " + eventId + " (simulation " + simulationId + ")";
    }
}
