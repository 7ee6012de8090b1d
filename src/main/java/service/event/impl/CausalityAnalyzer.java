package service.event.impl;

import common.consts.ErrorCodes;
import common.exception.BusinessException;
import engine.SimEvent;
import model.dto.response.CausalityReport;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 因果图分析
 * 一次遍历建立 eventLookup（ID -> 事件）与 causalityMap（父事件ID -> 引用它的子事件）。
 * 图中的环是生产方缺陷，但遍历不假设无环。
 */
public class CausalityAnalyzer {

    private final Map<String, SimEvent> eventLookup = new LinkedHashMap<>();
    private final Map<String, List<SimEvent>> causalityMap = new HashMap<>();
    private final Set<String> duplicateIds = new LinkedHashSet<>();

    /**
     * @param events 按分段读取顺序排列的事件，同ID只保留第一次出现
     */
    public CausalityAnalyzer(List<SimEvent> events) {
        for (SimEvent event : events) {
            if (eventLookup.putIfAbsent(event.getEventId(), event) != null) {
                duplicateIds.add(event.getEventId());
                continue;
            }
            for (String parentId : new LinkedHashSet<>(event.getCausedBy())) {
                causalityMap.computeIfAbsent(parentId, k -> new ArrayList<>()).add(event);
            }
        }
        causalityMap.values().forEach(Collections::sort);
    }

    public Optional<SimEvent> find(String eventId) {
        return Optional.ofNullable(eventLookup.get(eventId));
    }

    public int size() {
        return eventLookup.size();
    }

    /**
     * depth 跳以内的全部祖先，不含目标自身，按发现顺序去重
     * 用显式栈做深度优先遍历；某节点若之后经更短路径到达，会按更短的跳数重新展开
     */
    public List<SimEvent> upstream(String eventId, int depth) {
        if (depth < 0) {
            throw new BusinessException(ErrorCodes.INVALID_DEPTH + ": " + depth);
        }
        List<SimEvent> ancestors = new ArrayList<>();
        Set<String> collected = new HashSet<>();
        Map<String, Integer> bestHop = new HashMap<>();
        Deque<Hop> stack = new ArrayDeque<>();

        bestHop.put(eventId, 0);
        stack.push(new Hop(eventId, 0));
        while (!stack.isEmpty()) {
            Hop hop = stack.pop();
            if (bestHop.get(hop.eventId()) < hop.distance()) {
                continue; // 已被更短路径覆盖
            }
            SimEvent current = eventLookup.get(hop.eventId());
            if (current == null) {
                continue;
            }
            if (hop.distance() > 0 && collected.add(current.getEventId())) {
                ancestors.add(current);
            }
            if (hop.distance() >= depth) {
                continue;
            }

            List<String> parents = current.getCausedBy();
            // 逆序入栈，出栈时保持 caused_by 的声明顺序
            for (int i = parents.size() - 1; i >= 0; i--) {
                String parentId = parents.get(i);
                if (parentId.equals(eventId) || !eventLookup.containsKey(parentId)) {
                    continue;
                }
                int distance = hop.distance() + 1;
                Integer seen = bestHop.get(parentId);
                if (seen != null && seen <= distance) {
                    continue;
                }
                bestHop.put(parentId, distance);
                stack.push(new Hop(parentId, distance));
            }
        }
        return ancestors;
    }

    /**
     * 直接引用该事件的子事件（只有一跳），按 (timestamp, event_id) 排序
     */
    public List<SimEvent> downstream(String eventId) {
        return new ArrayList<>(causalityMap.getOrDefault(eventId, List.of()));
    }

    /**
     * 生成完整性报告：悬空引用、父晚于子、重复ID、环
     */
    public CausalityReport report(String simulationId) {
        CausalityReport report = new CausalityReport();
        report.setSimulationId(simulationId);
        report.setEventCount(eventLookup.size());
        report.getDuplicateEventIds().addAll(duplicateIds);

        for (SimEvent event : eventLookup.values()) {
            for (String parentId : new LinkedHashSet<>(event.getCausedBy())) {
                SimEvent parent = eventLookup.get(parentId);
                if (parent == null) {
                    report.getDanglingReferences().add(new CausalityReport.Violation(event.getEventId(), parentId));
                } else if (parent.getTimestamp().isAfter(event.getTimestamp())) {
                    report.getTemporalViolations().add(new CausalityReport.Violation(event.getEventId(), parentId));
                }
            }
        }

        List<String> cyclic = new ArrayList<>(findCyclicEvents());
        Collections.sort(cyclic);
        report.setCyclicEventIds(cyclic);
        return report;
    }

    /**
     * Tarjan 强连通分量（迭代实现），节点数大于 1 的分量或自引用节点即位于环上
     */
    private Set<String> findCyclicEvents() {
        Set<String> cyclic = new LinkedHashSet<>();
        Map<String, Integer> index = new HashMap<>();
        Map<String, Integer> lowLink = new HashMap<>();
        Deque<String> componentStack = new ArrayDeque<>();
        Set<String> onStack = new HashSet<>();
        int counter = 0;

        for (String root : eventLookup.keySet()) {
            if (index.containsKey(root)) {
                continue;
            }
            Deque<Visit> work = new ArrayDeque<>();
            index.put(root, counter);
            lowLink.put(root, counter);
            counter++;
            componentStack.push(root);
            onStack.add(root);
            work.push(new Visit(root, parentsOf(root).iterator()));

            while (!work.isEmpty()) {
                Visit visit = work.peek();
                if (visit.parents().hasNext()) {
                    String next = visit.parents().next();
                    if (!index.containsKey(next)) {
                        index.put(next, counter);
                        lowLink.put(next, counter);
                        counter++;
                        componentStack.push(next);
                        onStack.add(next);
                        work.push(new Visit(next, parentsOf(next).iterator()));
                    } else if (onStack.contains(next)) {
                        lowLink.put(visit.eventId(), Math.min(lowLink.get(visit.eventId()), index.get(next)));
                    }
                    continue;
                }

                work.pop();
                String node = visit.eventId();
                if (!work.isEmpty()) {
                    String caller = work.peek().eventId();
                    lowLink.put(caller, Math.min(lowLink.get(caller), lowLink.get(node)));
                }
                if (lowLink.get(node).equals(index.get(node))) {
                    List<String> component = new ArrayList<>();
                    String member;
                    do {
                        member = componentStack.pop();
                        onStack.remove(member);
                        component.add(member);
                    } while (!member.equals(node));
                    if (component.size() > 1 || eventLookup.get(node).getCausedBy().contains(node)) {
                        cyclic.addAll(component);
                    }
                }
            }
        }
        return cyclic;
    }

    private List<String> parentsOf(String eventId) {
        List<String> parents = new ArrayList<>();
        for (String parentId : new LinkedHashSet<>(eventLookup.get(eventId).getCausedBy())) {
            if (eventLookup.containsKey(parentId)) {
                parents.add(parentId);
            }
        }
        return parents;
    }

    private record Hop(String eventId, int distance) {}

    private record Visit(String eventId, Iterator<String> parents) {}
}
