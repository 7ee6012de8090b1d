package service.event.impl;

import common.consts.EventTypeEnum;
import common.exception.BusinessException;
import engine.SimEvent;
import model.dto.response.CausalityReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("因果图分析测试")
class CausalityAnalyzerTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    /**
     * turn_start <- decision <- action <- state_change, turn_end 同时引用 action 与 state_change
     */
    private static List<SimEvent> turnChain() {
        return List.of(
                event("turn_start", 0),
                event("decision", 1, "turn_start"),
                event("action", 2, "decision"),
                event("state_change", 3, "action"),
                event("turn_end", 4, "action", "state_change"));
    }

    @Test
    @DisplayName("深度 5：回溯到回合开始")
    void testUpstreamDepthFive() {
        CausalityAnalyzer analyzer = new CausalityAnalyzer(turnChain());

        List<SimEvent> upstream = analyzer.upstream("turn_end", 5);
        assertEquals(Set.of("state_change", "action", "decision", "turn_start"), idSet(upstream));
        assertEquals(4, upstream.size(), "祖先不应重复");
        assertTrue(analyzer.upstream("turn_start", 5).isEmpty());
    }

    @Test
    @DisplayName("深度 2：只到动作与状态变化的上一层")
    void testUpstreamDepthTwo() {
        CausalityAnalyzer analyzer = new CausalityAnalyzer(turnChain());

        assertEquals(Set.of("action", "state_change", "decision"), idSet(analyzer.upstream("turn_end", 2)));
        assertEquals(Set.of("action", "state_change"), idSet(analyzer.upstream("turn_end", 1)));
        assertTrue(analyzer.upstream("turn_end", 0).isEmpty());
    }

    @Test
    @DisplayName("上游按 caused_by 声明顺序深度优先")
    void testUpstreamOrder() {
        CausalityAnalyzer analyzer = new CausalityAnalyzer(turnChain());
        assertEquals(List.of("action", "decision", "turn_start", "state_change"),
                ids(analyzer.upstream("turn_end", 5)));
    }

    @Test
    @DisplayName("经更短路径再次到达的节点按更短跳数继续展开")
    void testShorterPathReExpanded() {
        // target -> a -> c -> x -> root
        // target -> b -> x
        List<SimEvent> events = List.of(
                event("root", 0),
                event("x", 1, "root"),
                event("c", 2, "x"),
                event("a", 3, "c"),
                event("b", 3, "x"),
                event("target", 4, "a", "b"));
        CausalityAnalyzer analyzer = new CausalityAnalyzer(events);

        // 先经 a -> c 在第 3 跳到达 x，深度已用完；之后经 b 在第 2 跳再次到达 x，root 落在第 3 跳
        assertEquals(Set.of("a", "b", "c", "x", "root"), idSet(analyzer.upstream("target", 3)));
        assertEquals(Set.of("a", "b", "c", "x"), idSet(analyzer.upstream("target", 2)));
    }

    @Test
    @DisplayName("线性链 turn_start -> action -> state_change -> turn_end")
    void testLinearTurnChain() {
        List<SimEvent> events = List.of(
                event("turn_start", 0),
                event("action", 1, "turn_start"),
                event("state_change", 2, "action"),
                event("turn_end", 3, "state_change"));
        CausalityAnalyzer analyzer = new CausalityAnalyzer(events);

        assertEquals(List.of("state_change", "action"), ids(analyzer.upstream("turn_end", 2)));
        assertEquals(List.of("state_change", "action", "turn_start"), ids(analyzer.upstream("turn_end", 5)));
        assertTrue(analyzer.downstream("turn_end").isEmpty());
        assertTrue(analyzer.upstream("turn_start", 5).isEmpty());
        assertEquals(List.of("action"), ids(analyzer.downstream("turn_start")));
    }

    @Test
    @DisplayName("下游只有一跳，按时间排序，重复引用只计一次")
    void testDownstreamOneHop() {
        List<SimEvent> events = new ArrayList<>(turnChain());
        events.add(event("late_observer", 10, "decision", "decision"));
        CausalityAnalyzer analyzer = new CausalityAnalyzer(events);

        assertEquals(List.of("action", "late_observer"), ids(analyzer.downstream("decision")));
        assertEquals(List.of("state_change", "turn_end"), ids(analyzer.downstream("action")));
        assertTrue(analyzer.downstream("turn_end").isEmpty());
        assertTrue(analyzer.downstream("missing").isEmpty());
    }

    @Test
    @DisplayName("多个父事件")
    void testMultipleParents() {
        List<SimEvent> events = List.of(
                event("price_a", 0),
                event("price_b", 0),
                event("trade", 1, "price_a", "price_b"));
        CausalityAnalyzer analyzer = new CausalityAnalyzer(events);

        assertEquals(List.of("price_a", "price_b"), ids(analyzer.upstream("trade", 1)));
        assertEquals(List.of("trade"), ids(analyzer.downstream("price_a")));
        assertEquals(List.of("trade"), ids(analyzer.downstream("price_b")));
    }

    @Test
    @Timeout(5)
    @DisplayName("遇到环时遍历仍然终止，目标自身不出现在上游")
    void testCycleTerminates() {
        List<SimEvent> events = List.of(
                event("a", 0, "c"),
                event("b", 1, "a"),
                event("c", 2, "b"),
                event("self", 3, "self"));
        CausalityAnalyzer analyzer = new CausalityAnalyzer(events);

        assertEquals(Set.of("b", "a"), idSet(analyzer.upstream("c", 20)));
        assertTrue(analyzer.upstream("self", 20).isEmpty());
    }

    @Test
    @DisplayName("悬空引用在遍历时忽略")
    void testDanglingParentIgnored() {
        CausalityAnalyzer analyzer = new CausalityAnalyzer(List.of(
                event("root", 0),
                event("child", 1, "ghost", "root")));
        assertEquals(List.of("root"), ids(analyzer.upstream("child", 5)));
    }

    @Test
    @DisplayName("未知事件与负深度")
    void testUnknownAndInvalidDepth() {
        CausalityAnalyzer analyzer = new CausalityAnalyzer(turnChain());
        assertTrue(analyzer.find("nope").isEmpty());
        assertTrue(analyzer.upstream("nope", 5).isEmpty());
        assertThrows(BusinessException.class, () -> analyzer.upstream("turn_end", -1));
    }

    @Test
    @DisplayName("重复ID只保留第一次出现")
    void testDuplicateIds() {
        SimEvent first = event("dup", 0);
        SimEvent second = event("dup", 9, "other");
        CausalityAnalyzer analyzer = new CausalityAnalyzer(List.of(first, event("other", 1), second));

        assertEquals(2, analyzer.size());
        assertSame(first, analyzer.find("dup").orElseThrow());
        assertTrue(analyzer.downstream("other").isEmpty(), "被丢弃的重复事件不参与建图");
    }

    @Test
    @DisplayName("干净的因果图生成空报告")
    void testCleanReport() {
        CausalityReport report = new CausalityAnalyzer(turnChain()).report("sim-1");
        assertTrue(report.isClean());
        assertEquals(5, report.getEventCount());
        assertEquals("sim-1", report.getSimulationId());
    }

    @Test
    @DisplayName("报告列出悬空引用、时间倒置、重复ID与环")
    void testReportFindsAllProblems() {
        List<SimEvent> events = List.of(
                event("root", 0),
                event("early_child", 0, "late_parent"),
                event("late_parent", 5, "root"),
                event("dangling", 6, "ghost"),
                event("x", 7, "z"),
                event("y", 8, "x"),
                event("z", 9, "y"),
                event("loop", 10, "loop"),
                event("root", 11));
        CausalityReport report = new CausalityAnalyzer(events).report("sim-2");

        assertFalse(report.isClean());
        assertEquals(8, report.getEventCount());
        assertEquals(List.of(new CausalityReport.Violation("dangling", "ghost")), report.getDanglingReferences());
        // z 在 x 之后，x 引用 z 即时间倒置
        assertEquals(List.of(
                        new CausalityReport.Violation("early_child", "late_parent"),
                        new CausalityReport.Violation("x", "z")),
                report.getTemporalViolations());
        assertEquals(List.of("root"), report.getDuplicateEventIds());
        assertEquals(List.of("loop", "x", "y", "z"), report.getCyclicEventIds());
    }

    private static SimEvent event(String id, int secondsAfterStart, String... causedBy) {
        SimEvent event = new SimEvent();
        event.setEventId(id);
        event.setTimestamp(T0.plusSeconds(secondsAfterStart));
        event.setSimulationId("sim");
        event.setEventType(EventTypeEnum.ACTION);
        event.setCausedBy(List.of(causedBy));
        return event;
    }

    private static List<String> ids(List<SimEvent> events) {
        return events.stream().map(SimEvent::getEventId).collect(Collectors.toList());
    }

    private static Set<String> idSet(List<SimEvent> events) {
        return new HashSet<>(ids(events));
    }
}
