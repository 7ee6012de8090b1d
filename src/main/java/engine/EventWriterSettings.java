package engine;

import common.config.EventStreamConfig;
import common.consts.VerbosityLevel;
import common.consts.WriteMode;
import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

/**
 * 单个仿真写入器的参数
 */
@Data
@Builder
public class EventWriterSettings {
    private Path outputDir;           // 该仿真的输出目录 output_root/{simulationId}
    private String simulationId;

    @Builder.Default
    private VerbosityLevel verbosity = VerbosityLevel.ACTION;

    @Builder.Default
    private WriteMode mode = WriteMode.CONCURRENT;

    @Builder.Default
    private int maxQueueSize = 10_000;              // 仅并发模式使用

    @Builder.Default
    private long maxFileSize = EventStreamConfig.DEFAULT_MAX_FILE_SIZE;
}
