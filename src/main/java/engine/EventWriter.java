package engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import common.consts.VerbosityLevel;
import common.consts.WriteMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 仿真事件写入器：按详细程度过滤后把事件以 JSONL 追加到 output_dir/events.jsonl，超过阈值时滚动。
 *
 * <p>CONCURRENT 模式下事件进入有界队列，由唯一的后台线程写盘；emit 永不阻塞，队列满时丢弃并计数。
 * DIRECT 模式下 emit 在调用线程内完成序列化、追加和 fsync。
 *
 * <p>start / emit / stop 均不抛异常：写入失败记录日志并计入丢弃数，写入器保持可用，丢失的事件不重试。
 * 任何时刻 已写入数 + 丢弃数 + 队列中 + 正在写入 = 已提交数（低于详细程度的事件不算提交）。
 * 并发模式下跨滚动边界的行，其回合号/时间戳顺序只保证最终一致，不保证逐行有序。
 */
public class EventWriter {

    private static final long POLL_INTERVAL_MS = 200;
    private static final int DROP_WARN_INTERVAL = 100;
    private static final Duration DEFAULT_STOP_TIMEOUT = Duration.ofSeconds(10);

    private enum Lifecycle { CREATED, RUNNING, STOPPED }

    private final Path outputDir;
    private final String simulationId;
    private final VerbosityLevel verbosity;
    private final WriteMode mode;
    private final int maxQueueSize;
    private final ObjectMapper objectMapper;
    private final Logger log;
    private final EventSegmentFile segmentFile;
    private final BlockingQueue<SimEvent> queue;
    private final AtomicLong droppedCount = new AtomicLong();

    // 消费线程与 stop 之间交接正在写的事件
    private final Object writeLock = new Object();
    private SimEvent inFlight;
    private boolean closed;

    private volatile Lifecycle lifecycle = Lifecycle.CREATED;
    private volatile boolean draining;
    private volatile boolean aborted;
    private Thread consumerThread;

    public EventWriter(EventWriterSettings settings, ObjectMapper objectMapper) {
        this(settings, objectMapper, LoggerFactory.getLogger(EventWriter.class));
    }

    public EventWriter(EventWriterSettings settings, ObjectMapper objectMapper, Logger log) {
        this.outputDir = settings.getOutputDir();
        this.simulationId = settings.getSimulationId();
        this.verbosity = settings.getVerbosity();
        this.mode = settings.getMode();
        this.maxQueueSize = settings.getMaxQueueSize();
        this.objectMapper = objectMapper;
        this.log = log;
        this.queue = mode == WriteMode.CONCURRENT ? new ArrayBlockingQueue<>(Math.max(1, maxQueueSize)) : null;

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            log.error("事件输出目录创建失败: dir={}, error={}", outputDir, e.getMessage());
        }
        this.segmentFile = new EventSegmentFile(outputDir, settings.getMaxFileSize(), log);
    }

    /**
     * 启动写入器，可重复调用
     * 并发模式启动唯一的消费线程；直接模式无需启动，构造后即可写
     */
    public synchronized void start() {
        if (lifecycle != Lifecycle.CREATED) {
            return;
        }
        lifecycle = Lifecycle.RUNNING;
        try {
            if (mode == WriteMode.CONCURRENT) {
                consumerThread = new Thread(this::consumeLoop, "event-writer-" + simulationId);
                consumerThread.setDaemon(true);
                consumerThread.start();
            }
            log.info("事件写入器已启动: simulationId={}, dir={}, mode={}, verbosity={}",
                    simulationId, outputDir, mode, verbosity);
        } catch (RuntimeException e) {
            log.error("事件写入器启动失败: simulationId={}", simulationId, e);
        }
    }

    /**
     * 提交一个事件
     * 低于详细程度的事件直接忽略（不计入丢弃数）
     */
    public void emit(SimEvent event) {
        if (event == null) {
            return;
        }
        try {
            if (!VerbosityPolicy.shouldLog(event.getEventType(), verbosity)) {
                return;
            }
            if (lifecycle == Lifecycle.STOPPED) {
                recordDrop(event, "写入器已停止");
                return;
            }
            if (mode == WriteMode.DIRECT) {
                byte[] line = serialize(event);
                if (line != null) {
                    append(event, line, true);
                }
                return;
            }
            if (!queue.offer(event)) {
                recordDrop(event, "队列已满");
            } else if (lifecycle == Lifecycle.STOPPED && queue.remove(event)) {
                // 与 stop 并发：stop 的最后一次排空可能已结束
                recordDrop(event, "写入器已停止");
            }
        } catch (RuntimeException e) {
            log.error("事件提交失败: eventId={}, error={}", event.getEventId(), e.getMessage(), e);
        }
    }

    public void stop() {
        stop(DEFAULT_STOP_TIMEOUT);
    }

    /**
     * 停止写入器，可重复调用
     * 并发模式在 timeout 内等待队列排空，超时后仍在队列中或正在写入的事件计入丢弃数；
     * 返回后消费线程不会再写盘
     */
    public void stop(Duration timeout) {
        Thread consumer;
        synchronized (this) {
            if (lifecycle == Lifecycle.STOPPED) {
                return;
            }
            lifecycle = Lifecycle.STOPPED;
            consumer = consumerThread;
        }
        try {
            if (mode == WriteMode.CONCURRENT) {
                drainAndJoin(consumer, timeout == null || timeout.isNegative() ? Duration.ZERO : timeout);
            }
            log.info("事件写入器已停止: simulationId={}, totalDropped={}", simulationId, droppedCount.get());
        } catch (RuntimeException e) {
            log.error("事件写入器停止异常: simulationId={}", simulationId, e);
        }
    }

    private void drainAndJoin(Thread consumer, Duration timeout) {
        draining = true;
        boolean interrupted = false;
        if (consumer != null) {
            try {
                consumer.join(Math.max(1L, timeout.toMillis()));
            } catch (InterruptedException e) {
                interrupted = true;
            }
            if (consumer.isAlive()) {
                log.warn("事件队列排空超时: simulationId={}, remaining={}, timeout={}ms",
                        simulationId, queue.size(), timeout.toMillis());
                aborted = true;
            }
        }

        // 关闭后消费线程不会再写盘，正在处理的事件由这里计入丢弃数
        synchronized (writeLock) {
            closed = true;
            if (inFlight != null) {
                recordDrop(inFlight, "停止时仍在写入");
                inFlight = null;
            }
        }

        List<SimEvent> leftover = new ArrayList<>();
        queue.drainTo(leftover);
        if (!leftover.isEmpty()) {
            droppedCount.addAndGet(leftover.size());
            log.warn("停止时丢弃未写入事件: simulationId={}, count={}", simulationId, leftover.size());
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private void consumeLoop() {
        while (!aborted) {
            SimEvent event;
            try {
                event = draining ? queue.poll() : queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (event == null) {
                if (draining) {
                    return;
                }
                continue;
            }
            consume(event);
        }
    }

    /**
     * 序列化在锁外进行，追加在锁内进行；stop 关闭后到达的事件只计数不写盘
     */
    private void consume(SimEvent event) {
        synchronized (writeLock) {
            if (closed) {
                recordDrop(event, "写入器已关闭");
                return;
            }
            inFlight = event;
        }
        byte[] line = serialize(event);
        synchronized (writeLock) {
            if (closed) {
                return; // stop 已计数
            }
            inFlight = null;
            if (line != null) {
                append(event, line, false);
            }
        }
    }

    /**
     * 序列化失败时记录日志并计入丢弃数，返回 null
     */
    private byte[] serialize(SimEvent event) {
        try {
            return (objectMapper.writeValueAsString(event) + "\n").getBytes(StandardCharsets.UTF_8);
        } catch (IOException | RuntimeException e) {
            log.error("事件序列化失败: eventId={}, error={}", event.getEventId(), e.getMessage());
            recordDrop(event, "序列化失败");
            return null;
        }
    }

    private void append(SimEvent event, byte[] line, boolean durable) {
        try {
            segmentFile.append(line, durable);
        } catch (IOException | RuntimeException e) {
            log.error("事件写入失败: file={}, eventId={}, error={}",
                    segmentFile.getCurrentFile(), event.getEventId(), e.getMessage());
            recordDrop(event, "写入失败");
        }
    }

    private void recordDrop(SimEvent event, String reason) {
        long dropped = droppedCount.incrementAndGet();
        log.debug("事件被丢弃({}): eventId={}, totalDropped={}", reason, event.getEventId(), dropped);
        if (dropped % DROP_WARN_INTERVAL == 0) {
            log.warn("事件持续丢弃: simulationId={}, totalDropped={}, maxQueueSize={}",
                    simulationId, dropped, maxQueueSize);
        }
    }

    public long getDroppedCount() {
        return droppedCount.get();
    }

    public long getCurrentSize() {
        return segmentFile.getCurrentSize();
    }

    public Path getCurrentFile() {
        return segmentFile.getCurrentFile();
    }

    public int getQueueDepth() {
        return queue == null ? 0 : queue.size();
    }

    public boolean isRunning() {
        return lifecycle == Lifecycle.RUNNING;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public String getSimulationId() {
        return simulationId;
    }

    public VerbosityLevel getVerbosity() {
        return verbosity;
    }

    public WriteMode getMode() {
        return mode;
    }
}
