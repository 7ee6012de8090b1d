package controller;

import application.EventStreamApplication;
import common.consts.VerbosityLevel;
import common.consts.WriteMode;
import engine.EventBuilder;
import engine.EventWriter;
import engine.SimEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import service.event.EventWriterFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 查询接口集成测试
 * 通过写入器工厂落盘，再经 HTTP 接口读取
 */
@SpringBootTest(classes = EventStreamApplication.class)
@AutoConfigureMockMvc
@DisplayName("仿真事件查询接口测试")
class SimEventControllerTest {

    @TempDir
    static Path outputRoot;

    @DynamicPropertySource
    static void eventProperties(DynamicPropertyRegistry registry) {
        registry.add("sim.events.output-root", () -> outputRoot.toString());
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private EventWriterFactory writerFactory;

    @Test
    @DisplayName("列出仿真")
    void testListSimulations() throws Exception {
        seed("listing-run");

        mockMvc.perform(get("/simulations"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data[*].id", hasItem("listing-run")))
                .andExpect(jsonPath("$.data[?(@.id == 'listing-run')].name").value("listing"))
                .andExpect(jsonPath("$.data[?(@.id == 'listing-run')].event_count").value(5));
    }

    @Test
    @DisplayName("按类型过滤并分页")
    void testListEvents() throws Exception {
        seed("filter-run");

        mockMvc.perform(get("/simulations/filter-run/events").param("event_types", "MILESTONE"))
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data.total").value(2))
                .andExpect(jsonPath("$.data.has_more").value(false))
                .andExpect(jsonPath("$.data.events[0].event_type").value("MILESTONE"))
                .andExpect(jsonPath("$.data.events[0].details.milestone_type").value("turn_start"));

        mockMvc.perform(get("/simulations/filter-run/events")
                        .param("event_types", "action", "state")
                        .param("agent_ids", "agent_alpha"))
                .andExpect(jsonPath("$.data.total").value(2));

        mockMvc.perform(get("/simulations/filter-run/events").param("limit", "2").param("offset", "0"))
                .andExpect(jsonPath("$.data.events", hasSize(2)))
                .andExpect(jsonPath("$.data.total").value(5))
                .andExpect(jsonPath("$.data.has_more").value(true));

        mockMvc.perform(get("/simulations/filter-run/events").param("start_timestamp", "2999-01-01T00:00:00Z"))
                .andExpect(jsonPath("$.data.total").value(0));
    }

    @Test
    @DisplayName("未知仿真返回空页")
    void testUnknownSimulation() throws Exception {
        mockMvc.perform(get("/simulations/never-ran/events"))
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data.total").value(0))
                .andExpect(jsonPath("$.data.events", hasSize(0)));
    }

    @Test
    @DisplayName("非法参数返回 400")
    void testInvalidParameters() throws Exception {
        seed("invalid-run");

        mockMvc.perform(get("/simulations/invalid-run/events").param("event_types", "ENV"))
                .andExpect(jsonPath("$.code").value(400));
        mockMvc.perform(get("/simulations/invalid-run/events").param("limit", "0"))
                .andExpect(jsonPath("$.code").value(400));
        mockMvc.perform(get("/simulations/invalid-run/events").param("limit", "abc"))
                .andExpect(jsonPath("$.code").value(400));
        mockMvc.perform(get("/simulations/invalid-run/events").param("turn_start", "5").param("turn_end", "1"))
                .andExpect(jsonPath("$.code").value(400));
        mockMvc.perform(get("/simulations/invalid-run/events").param("start_timestamp", "not-a-time"))
                .andExpect(jsonPath("$.code").value(400));
        mockMvc.perform(get("/simulations/a..b/events"))
                .andExpect(jsonPath("$.code").value(400));
    }

    @Test
    @DisplayName("按ID查询事件，不存在时返回 404")
    void testGetEvent() throws Exception {
        List<SimEvent> events = seed("lookup-run");
        SimEvent decision = events.get(1);

        mockMvc.perform(get("/simulations/lookup-run/events/{eventId}", decision.getEventId()))
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data.event_id").value(decision.getEventId()))
                .andExpect(jsonPath("$.data.agent_id").value("agent_alpha"))
                .andExpect(jsonPath("$.data.details.new_value").value(1.1));

        mockMvc.perform(get("/simulations/lookup-run/events/{eventId}", "01ARZ3NDEKTSV4RRFFQ69G5FAV"))
                .andExpect(jsonPath("$.code").value(404));
    }

    @Test
    @DisplayName("因果链查询")
    void testCausalityChain() throws Exception {
        List<SimEvent> events = seed("causality-run");
        SimEvent turnStart = events.get(0);
        SimEvent decision = events.get(1);
        SimEvent action = events.get(2);
        SimEvent state = events.get(3);
        SimEvent turnEnd = events.get(4);

        mockMvc.perform(get("/simulations/causality-run/causality/{eventId}", turnEnd.getEventId())
                        .param("depth", "1"))
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data.event_id").value(turnEnd.getEventId()))
                .andExpect(jsonPath("$.data.upstream[*].event_id",
                        containsInAnyOrder(action.getEventId(), state.getEventId())))
                .andExpect(jsonPath("$.data.downstream", hasSize(0)));

        // 默认深度 5
        mockMvc.perform(get("/simulations/causality-run/causality/{eventId}", turnEnd.getEventId()))
                .andExpect(jsonPath("$.data.upstream", hasSize(4)));

        mockMvc.perform(get("/simulations/causality-run/causality/{eventId}", turnStart.getEventId()))
                .andExpect(jsonPath("$.data.upstream", hasSize(0)))
                .andExpect(jsonPath("$.data.downstream[*].event_id", containsInAnyOrder(decision.getEventId())));

        mockMvc.perform(get("/simulations/causality-run/causality/{eventId}", turnEnd.getEventId())
                        .param("depth", "21"))
                .andExpect(jsonPath("$.code").value(400));
        mockMvc.perform(get("/simulations/causality-run/causality/{eventId}", "missing"))
                .andExpect(jsonPath("$.code").value(404));
    }

    @Test
    @DisplayName("因果完整性报告")
    void testCausalityReport() throws Exception {
        seed("report-run");

        mockMvc.perform(get("/simulations/report-run/causality-report"))
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data.simulation_id").value("report-run"))
                .andExpect(jsonPath("$.data.event_count").value(5))
                .andExpect(jsonPath("$.data.dangling_references", hasSize(0)))
                .andExpect(jsonPath("$.data.cyclic_event_ids", hasSize(0)));
    }

    /**
     * 写入一个回合：turn_start -> decision -> action -> state_change -> turn_end
     */
    private List<SimEvent> seed(String simulationId) {
        EventWriter writer = writerFactory.create(simulationId, WriteMode.DIRECT, VerbosityLevel.DETAIL);
        writer.start();

        SimEvent turnStart = EventBuilder.milestone(simulationId, 1, "turn_start", "Turn 1 started", null);
        SimEvent decision = EventBuilder.decision(simulationId, 1, "agent_alpha", "interest_rate",
                1.0, 1.1, null, List.of(turnStart.getEventId()));
        SimEvent action = EventBuilder.action(simulationId, 1, "agent_alpha", "submit_rate",
                Map.of("rate", 1.1), null, List.of(decision.getEventId()));
        SimEvent state = EventBuilder.state(simulationId, 1, "interest_rate", 1.0, 1.1,
                "agent_alpha", "agent", null, List.of(action.getEventId()));
        SimEvent turnEnd = EventBuilder.milestone(simulationId, 1, "turn_end", "Turn 1 finished",
                List.of(action.getEventId(), state.getEventId()));

        List<SimEvent> events = List.of(turnStart, decision, action, state, turnEnd);
        events.forEach(writer::emit);
        writerFactory.close(writer);
        return events;
    }
}
