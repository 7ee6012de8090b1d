package service.event;

import com.fasterxml.jackson.databind.ObjectMapper;
import common.config.EventStreamConfig;
import common.consts.VerbosityLevel;
import common.consts.WriteMode;
import common.util.SimulationIdUtil;
import engine.EventWriter;
import engine.EventWriterSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * 按配置为每次仿真运行创建写入器
 * 编排器在仿真开始时 open，结束时 close；每个写入器持有独立的 logger，互不干扰
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EventWriterFactory {

    private final EventStreamConfig config;
    private final ObjectMapper objectMapper;

    public EventWriter create(String simulationId) {
        return create(simulationId, config.getMode(), config.getVerbosity());
    }

    public EventWriter create(String simulationId, WriteMode mode, VerbosityLevel verbosity) {
        EventWriterSettings settings = EventWriterSettings.builder()
                .outputDir(simulationDir(simulationId))
                .simulationId(simulationId)
                .mode(mode)
                .verbosity(verbosity)
                .maxQueueSize(config.getMaxQueueSize())
                .maxFileSize(config.getMaxFileSize())
                .build();
        return new EventWriter(settings, objectMapper,
                LoggerFactory.getLogger(EventWriter.class.getName() + "." + simulationId));
    }

    /**
     * 创建并启动
     */
    public EventWriter open(String simulationId) {
        EventWriter writer = create(simulationId);
        writer.start();
        return writer;
    }

    /**
     * 按配置的超时停止写入器
     */
    public void close(EventWriter writer) {
        writer.stop(Duration.ofMillis(config.getStopTimeoutMs()));
        if (writer.getDroppedCount() > 0) {
            log.warn("仿真事件存在丢弃: simulationId={}, dropped={}", writer.getSimulationId(), writer.getDroppedCount());
        }
    }

    /**
     * 非法的仿真ID（空、含路径分隔符或 ..）抛出业务异常，写入端不会在输出根目录之外建目录
     */
    public Path simulationDir(String simulationId) {
        return SimulationIdUtil.resolve(Paths.get(config.getOutputRoot()), simulationId);
    }
}
