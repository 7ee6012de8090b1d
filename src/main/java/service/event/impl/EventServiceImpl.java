package service.event.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import common.config.EventStreamConfig;
import common.consts.ErrorCodes;
import common.exception.BusinessException;
import common.util.SimulationIdUtil;
import engine.SimEvent;
import model.dto.request.EventFilter;
import model.dto.response.CausalityChain;
import model.dto.response.CausalityReport;
import model.dto.response.EventPage;
import model.dto.response.SimulationSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import service.event.EventService;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Service
public class EventServiceImpl implements EventService {

    private final Path outputRoot;
    private final EventSegmentReader segmentReader;
    private final Logger log;

    @Autowired
    public EventServiceImpl(EventStreamConfig config, ObjectMapper objectMapper) {
        this(Paths.get(config.getOutputRoot()), objectMapper, LoggerFactory.getLogger(EventServiceImpl.class));
    }

    public EventServiceImpl(Path outputRoot, ObjectMapper objectMapper, Logger log) {
        this.outputRoot = outputRoot;
        this.segmentReader = new EventSegmentReader(objectMapper, log);
        this.log = log;
    }

    @Override
    public List<SimulationSummary> listSimulations() {
        List<SimulationSummary> simulations = new ArrayList<>();
        if (!Files.isDirectory(outputRoot)) {
            return simulations;
        }

        List<Path> dirs;
        try (Stream<Path> children = Files.list(outputRoot)) {
            dirs = children.filter(Files::isDirectory).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("读取输出根目录失败: root={}, error={}", outputRoot, e.getMessage());
            return simulations;
        }

        for (Path dir : dirs) {
            List<Path> segments = segmentReader.listSegments(dir);
            if (segments.isEmpty()) {
                continue;
            }
            long eventCount = 0;
            for (Path segment : segments) {
                eventCount += segmentReader.countLines(segment);
            }
            String id = dir.getFileName().toString();
            simulations.add(new SimulationSummary(id, displayName(id), startTime(segments), eventCount));
        }
        return simulations;
    }

    @Override
    public EventPage getFilteredEvents(String simulationId, EventFilter filter) {
        EventFilter criteria = filter == null ? EventFilter.builder().build() : filter;
        criteria.validate();
        Path dir = simulationDir(simulationId);
        if (!Files.isDirectory(dir)) {
            return EventPage.empty();
        }

        List<SimEvent> matched = new ArrayList<>();
        for (SimEvent event : segmentReader.readAll(dir)) {
            if (criteria.matches(event)) {
                matched.add(event);
            }
        }
        // 排序与文件顺序无关：(timestamp, event_id)
        matched.sort(null);

        int total = matched.size();
        int from = Math.min(criteria.getOffset(), total);
        int to = (int) Math.min((long) from + criteria.getLimit(), total);
        boolean hasMore = (long) criteria.getOffset() + criteria.getLimit() < total;
        return new EventPage(new ArrayList<>(matched.subList(from, to)), total, hasMore);
    }

    @Override
    public Optional<SimEvent> getEventById(String simulationId, String eventId) {
        Path dir = simulationDir(simulationId);
        if (eventId == null || !Files.isDirectory(dir)) {
            return Optional.empty();
        }
        return segmentReader.findFirst(dir, event -> eventId.equals(event.getEventId()));
    }

    @Override
    public Optional<CausalityChain> getCausalityChain(String simulationId, String eventId, int depth) {
        if (depth < 0) {
            throw new BusinessException(ErrorCodes.INVALID_DEPTH + ": " + depth);
        }
        Path dir = simulationDir(simulationId);
        if (eventId == null || !Files.isDirectory(dir)) {
            return Optional.empty();
        }

        CausalityAnalyzer analyzer = new CausalityAnalyzer(segmentReader.readAll(dir));
        return analyzer.find(eventId).map(event -> new CausalityChain(
                eventId,
                event,
                analyzer.upstream(eventId, depth),
                analyzer.downstream(eventId)));
    }

    @Override
    public CausalityReport verifyCausality(String simulationId) {
        Path dir = simulationDir(simulationId);
        List<SimEvent> events = Files.isDirectory(dir) ? segmentReader.readAll(dir) : List.of();
        CausalityReport report = new CausalityAnalyzer(events).report(simulationId);
        if (!report.isClean()) {
            log.info("因果引用存在问题: simulationId={}, dangling={}, temporal={}, duplicates={}, cyclic={}",
                    simulationId, report.getDanglingReferences().size(), report.getTemporalViolations().size(),
                    report.getDuplicateEventIds().size(), report.getCyclicEventIds().size());
        }
        return report;
    }

    private Path simulationDir(String simulationId) {
        return SimulationIdUtil.resolve(outputRoot, simulationId);
    }

    /**
     * 最早的、首行可解析的分段给出开始时间
     */
    private Instant startTime(List<Path> segments) {
        for (Path segment : segments) {
            Optional<SimEvent> first = segmentReader.readFirstEvent(segment);
            if (first.isPresent()) {
                return first.get().getTimestamp();
            }
        }
        return null;
    }

    private static String displayName(String id) {
        int dash = id.indexOf('-');
        return dash > 0 ? id.substring(0, dash) : id;
    }
}
