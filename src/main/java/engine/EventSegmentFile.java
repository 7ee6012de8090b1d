package engine;

import common.util.TimeUtil;
import org.slf4j.Logger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.regex.Pattern;

/**
 * 当前分段文件 events.jsonl 及其滚动
 * 写后检查大小，超过阈值即把当前文件改名为带微秒时间戳的历史分段，再新建空的 events.jsonl。
 * 因此单个分段最多超出阈值一条事件的长度。
 */
public class EventSegmentFile {

    public static final String CURRENT_FILE_NAME = "events.jsonl";

    /**
     * events.jsonl 或 events_2024-01-31_23-59-59-123456.jsonl
     */
    public static final Pattern SEGMENT_NAME =
            Pattern.compile("events(?:_\\d{4}-\\d{2}-\\d{2}_\\d{2}-\\d{2}-\\d{2}-\\d{6})?\\.jsonl");

    private final Path directory;
    private final Path currentFile;
    private final long maxFileSize;
    private final Logger log;

    private long currentSize;

    public EventSegmentFile(Path directory, long maxFileSize, Logger log) {
        this.directory = directory;
        this.currentFile = directory.resolve(CURRENT_FILE_NAME);
        this.maxFileSize = maxFileSize;
        this.log = log;
        this.currentSize = existingSize(currentFile);
    }

    public static boolean isSegmentName(String fileName) {
        return SEGMENT_NAME.matcher(fileName).matches();
    }

    public static String rotatedName(Instant instant) {
        return "events_" + TimeUtil.formatSegmentStamp(instant) + ".jsonl";
    }

    /**
     * 追加一行（已含换行符），durable 为 true 时强制刷盘
     */
    public synchronized void append(byte[] line, boolean durable) throws IOException {
        try (FileChannel channel = FileChannel.open(currentFile,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            ByteBuffer buffer = ByteBuffer.wrap(line);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            if (durable) {
                channel.force(false);
            }
        }
        currentSize += line.length;

        if (currentSize > maxFileSize) {
            rotate();
        }
    }

    /**
     * 滚动当前分段，返回历史分段路径；改名失败时返回 null，计数照常清零
     */
    public synchronized Path rotate() {
        Path rotated = null;
        if (Files.exists(currentFile)) {
            Path target = nextRotatedPath();
            try {
                moveAtomically(currentFile, target);
                rotated = target;
                log.info("事件文件已滚动: {} -> {}, size={} bytes", currentFile.getFileName(),
                        target.getFileName(), currentSize);
            } catch (IOException e) {
                log.error("事件文件滚动失败: file={}, error={}", currentFile, e.getMessage(), e);
            }
        }
        currentSize = 0;

        if (rotated != null) {
            try {
                Files.createFile(currentFile);
            } catch (IOException e) {
                // 下一次 append 会以 CREATE 方式重新创建
                log.warn("新分段文件创建失败: file={}, error={}", currentFile, e.getMessage());
            }
        }
        return rotated;
    }

    public synchronized long getCurrentSize() {
        return currentSize;
    }

    public Path getCurrentFile() {
        return currentFile;
    }

    private Path nextRotatedPath() {
        Instant stamp = Instant.now();
        Path target = directory.resolve(rotatedName(stamp));
        // 同一微秒内的连续滚动：顺延一微秒直到文件名空闲
        while (Files.exists(target)) {
            stamp = stamp.plus(1, ChronoUnit.MICROS);
            target = directory.resolve(rotatedName(stamp));
        }
        return target;
    }

    private static void moveAtomically(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target);
        }
    }

    private long existingSize(Path file) {
        try {
            return Files.exists(file) ? Files.size(file) : 0L;
        } catch (IOException e) {
            log.warn("读取已有分段大小失败，按 0 处理: file={}, error={}", file, e.getMessage());
            return 0L;
        }
    }
}
