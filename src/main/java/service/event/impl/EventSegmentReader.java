package service.event.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import engine.EventSegmentFile;
import engine.SimEvent;
import org.slf4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 分段文件读取
 * 历史分段按文件名（即滚动时间）排序，当前分段 events.jsonl 永远排在最后。
 * 无法解析的行、信封不完整的行、无法读取的文件一律跳过。
 */
public class EventSegmentReader {

    private final ObjectMapper objectMapper;
    private final Logger log;

    public EventSegmentReader(ObjectMapper objectMapper, Logger log) {
        this.objectMapper = objectMapper;
        this.log = log;
    }

    /**
     * 按时间从旧到新列出目录中的分段
     */
    public List<Path> listSegments(Path simulationDir) {
        if (!Files.isDirectory(simulationDir)) {
            return List.of();
        }
        List<Path> rotated = new ArrayList<>();
        Path current = null;
        try (Stream<Path> files = Files.list(simulationDir)) {
            for (Path file : files.collect(Collectors.toList())) {
                String name = file.getFileName().toString();
                if (!Files.isRegularFile(file) || !EventSegmentFile.isSegmentName(name)) {
                    continue;
                }
                if (EventSegmentFile.CURRENT_FILE_NAME.equals(name)) {
                    current = file;
                } else {
                    rotated.add(file);
                }
            }
        } catch (IOException e) {
            log.warn("读取仿真目录失败: dir={}, error={}", simulationDir, e.getMessage());
            return List.of();
        }
        rotated.sort((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()));
        if (current != null) {
            rotated.add(current);
        }
        return rotated;
    }

    /**
     * 读取目录下全部事件，保持分段与行的原始顺序
     */
    public List<SimEvent> readAll(Path simulationDir) {
        List<SimEvent> events = new ArrayList<>();
        for (Path segment : listSegments(simulationDir)) {
            scan(segment, event -> {
                events.add(event);
                return true;
            });
        }
        return events;
    }

    /**
     * 按分段顺序查找第一个满足条件的事件
     */
    public Optional<SimEvent> findFirst(Path simulationDir, Predicate<SimEvent> condition) {
        for (Path segment : listSegments(simulationDir)) {
            SimEvent[] found = new SimEvent[1];
            scan(segment, event -> {
                if (condition.test(event)) {
                    found[0] = event;
                    return false;
                }
                return true;
            });
            if (found[0] != null) {
                return Optional.of(found[0]);
            }
        }
        return Optional.empty();
    }

    /**
     * 读取分段的第一条非空行，该行损坏时返回空
     */
    public Optional<SimEvent> readFirstEvent(Path segment) {
        try (BufferedReader reader = open(segment)) {
            String line = reader.readLine();
            while (line != null && line.isBlank()) {
                line = reader.readLine();
            }
            return line == null ? Optional.empty() : parseLine(line, segment);
        } catch (IOException e) {
            log.debug("分段读取失败，已跳过: file={}, error={}", segment, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * 统计分段中的非空行数，读取失败按 0 计
     */
    public long countLines(Path segment) {
        long count = 0;
        try (BufferedReader reader = open(segment)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    count++;
                }
            }
        } catch (IOException e) {
            log.debug("分段读取失败，已跳过: file={}, error={}", segment, e.getMessage());
            return 0;
        }
        return count;
    }

    /**
     * 逐条回调，visitor 返回 false 时提前结束
     */
    private void scan(Path segment, Predicate<SimEvent> visitor) {
        try (BufferedReader reader = open(segment)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                Optional<SimEvent> event = parseLine(line, segment);
                if (event.isPresent() && !visitor.test(event.get())) {
                    return;
                }
            }
        } catch (IOException e) {
            log.debug("分段读取失败，已跳过: file={}, error={}", segment, e.getMessage());
        }
    }

    private Optional<SimEvent> parseLine(String line, Path segment) {
        try {
            SimEvent event = objectMapper.readValue(line, SimEvent.class);
            if (event == null || !event.isEnvelopeComplete()) {
                log.debug("事件信封不完整，已跳过: file={}", segment.getFileName());
                return Optional.empty();
            }
            return Optional.of(event);
        } catch (JsonProcessingException e) {
            // 写入中的最后一行也会走到这里
            log.debug("无法解析的事件行，已跳过: file={}, error={}", segment.getFileName(), e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private static BufferedReader open(Path segment) throws IOException {
        // InputStreamReader 对非法 UTF-8 字节做替换而不是抛异常，坏字节只影响所在行
        return new BufferedReader(new InputStreamReader(Files.newInputStream(segment), StandardCharsets.UTF_8));
    }
}
