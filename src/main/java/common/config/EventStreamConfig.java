package common.config;

import common.consts.VerbosityLevel;
import common.consts.WriteMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 事件流配置
 * 写入端与查询端共用的参数统一在这里管理，可通过 Spring 配置文件覆盖：
 *
 * sim.events.output-root
 * sim.events.verbosity
 * sim.events.mode
 * sim.events.max-queue-size
 * sim.events.max-file-size
 * sim.events.stop-timeout-ms
 * sim.events.default-causality-depth
 */
@Configuration
@ConfigurationProperties(prefix = "sim.events")
@Data
public class EventStreamConfig {

    /**
     * 500 MiB
     */
    public static final long DEFAULT_MAX_FILE_SIZE = 500L * 1024 * 1024;

    /**
     * 仿真输出根目录，每个仿真一个子目录
     */
    private String outputRoot = "output";

    /**
     * 写入详细程度
     */
    private VerbosityLevel verbosity = VerbosityLevel.ACTION;

    /**
     * 写入模式
     */
    private WriteMode mode = WriteMode.CONCURRENT;

    /**
     * 并发模式下的队列上限，超出即丢弃
     */
    private int maxQueueSize = 10_000;

    /**
     * 单个分段文件的滚动阈值 (字节)
     */
    private long maxFileSize = DEFAULT_MAX_FILE_SIZE;

    /**
     * stop 时等待队列排空的最长时间 (毫秒)
     */
    private long stopTimeoutMs = 10_000;

    /**
     * 因果链查询的默认深度
     */
    private int defaultCausalityDepth = 5;
}
