package io.github.vevoly.hitset.core.archive;

import com.google.common.base.Preconditions;
import io.github.vevoly.hitset.api.constants.HitSetConstant;
import io.github.vevoly.hitset.api.exception.ArchiveException;
import io.github.vevoly.hitset.api.exception.HitSetErrorCode;
import io.github.vevoly.hitset.api.exception.MalformedInputException;
import io.github.vevoly.hitset.core.HitSet;
import io.github.vevoly.hitset.core.metrics.HitSetMetrics;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * <h3>命中集归档 (Hit Set Archive)</h3>
 *
 * <p>
 * 将周期结束后的命中集以线路格式持久化到本地目录，每个 {@code (分片, 周期)} 一个文件。
 * 采用 <b>原子文件操作</b>：先写临时文件，再原子重命名，读取方永远看不到写了一半的归档。
 * 多个周期的保留与合并策略不在本类职责范围内。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Hit Set Archive.</b><br>
 * Persists finished hit sets in wire form under a local directory, one file per {@code (shard, interval)}.
 * Uses <b>Atomic File Operations</b> (temp file, then atomic rename) so readers never see a partial archive.
 * Retention and aggregation across intervals are left to the caller.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Slf4j
public class HitSetArchive {

    private final Path archiveDir;
    private final HitSetMetrics metrics;

    /**
     * 构造函数 (Constructor).
     *
     * @param baseDir 根目录，归档写入其下的 {@value HitSetConstant#ARCHIVE_DIR} 子目录 (Base directory)
     */
    public HitSetArchive(String baseDir) {
        this(baseDir, null);
    }

    /**
     * 构造函数 (Constructor).
     *
     * @param baseDir 根目录 (Base directory)
     * @param metrics 监控指标，可为 null (Metrics, nullable)
     */
    public HitSetArchive(String baseDir, HitSetMetrics metrics) {
        Preconditions.checkArgument(baseDir != null && !baseDir.trim().isEmpty(), "archive base dir must be set");
        this.archiveDir = Paths.get(baseDir, HitSetConstant.ARCHIVE_DIR);
        this.metrics = metrics;
        try {
            Files.createDirectories(archiveDir);
        } catch (IOException e) {
            throw new UncheckedIOException("无法创建归档目录 / Cannot create archive dir: " + archiveDir, e);
        }
    }

    public Path getArchiveDir() {
        return archiveDir;
    }

    /**
     * 保存归档 (原子写入).
     * <p>同一条目已存在时被覆盖。</p>
     *
     * <hr>
     * <span style="color: gray; font-size: 0.9em;">
     * <b>Save Archive (Atomic Write).</b> An existing archive for the same entry is replaced.
     * </span>
     *
     * @param entry  归档条目 (Entry)
     * @param hitSet 命中集 (Hit set)
     * @return 归档文件路径 (Archive file)
     * @throws ArchiveException 写入或重命名失败 (Write or rename failed)
     */
    public Path save(ArchiveEntry entry, HitSet hitSet) throws ArchiveException {
        Preconditions.checkNotNull(entry, "entry");
        Preconditions.checkNotNull(hitSet, "hit set");
        Path finalFile = archiveDir.resolve(entry.getFileName());
        Path tempFile = archiveDir.resolve(entry.getFileName() + HitSetConstant.ARCHIVE_TEMP_SUFFIX);
        byte[] bytes = hitSet.toBytes();

        // 1. 写入临时文件 / Write to temporary file
        try {
            Files.write(tempFile, bytes);
        } catch (IOException e) {
            log.error("归档写入临时文件失败 / Failed to write archive to temp file: {}", tempFile, e);
            throw new ArchiveException(HitSetErrorCode.ARCHIVE_SAVE_FAILED, "写入临时文件失败 / Temp write failed: " + tempFile, e);
        }

        // 2. 原子重命名 / Atomic rename
        try {
            Files.move(tempFile, finalFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.error("归档文件重命名失败 / Failed to rename archive file: {}", finalFile, e);
            deleteQuietly(tempFile);
            throw new ArchiveException(HitSetErrorCode.ARCHIVE_SAVE_FAILED, "重命名失败 / Rename failed: " + finalFile, e);
        }
        log.info("归档保存成功 / Archive saved: {} ({} bytes, type={})", entry.getFileName(), bytes.length, hitSet.getTypeName());
        if (metrics != null) {
            metrics.recordArchived(entry.getShard(), bytes.length);
        }
        return finalFile;
    }

    /**
     * 加载归档 / Load an archived hit set
     *
     * @throws ArchiveException 文件不存在、无法读取或内容损坏 (Missing, unreadable or corrupted)
     */
    public HitSet load(ArchiveEntry entry) throws ArchiveException {
        Preconditions.checkNotNull(entry, "entry");
        return load(archiveDir.resolve(entry.getFileName()));
    }

    /**
     * 按路径加载归档文件 / Load an archive file by path
     */
    public static HitSet load(Path file) throws ArchiveException {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            throw new ArchiveException(HitSetErrorCode.ARCHIVE_LOAD_FAILED, "归档不存在 / Archive not found: " + file, e);
        } catch (IOException e) {
            log.error("归档读取失败 / Failed to read archive: {}", file, e);
            throw new ArchiveException(HitSetErrorCode.ARCHIVE_LOAD_FAILED, "读取失败 / Read failed: " + file, e);
        }
        try {
            return HitSet.fromBytes(bytes);
        } catch (MalformedInputException e) {
            log.error("归档文件损坏或版本不兼容 / Archive corrupted or incompatible: {}", file, e);
            throw new ArchiveException(HitSetErrorCode.ARCHIVE_LOAD_FAILED, "归档损坏 / Archive corrupted: " + file, e);
        }
    }

    /**
     * 列出某分片的全部归档，按周期开始时间排序.
     * <br>
     * <span style="color: gray;">All archives of a shard, ordered by interval begin.</span>
     */
    public List<ArchiveEntry> list(String shard) throws ArchiveException {
        try (Stream<Path> files = Files.list(archiveDir)) {
            return files.map(path -> path.getFileName().toString())
                    .map(ArchiveEntry::parse)
                    .filter(Optional::isPresent)
                    .map(Optional::get)
                    .filter(entry -> entry.getShard().equals(shard))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ArchiveException(HitSetErrorCode.ARCHIVE_LOAD_FAILED, "无法列出归档 / Cannot list archives: " + archiveDir, e);
        }
    }

    /**
     * 删除归档 (Remove Archive).
     *
     * @return 文件是否存在并已删除 (Whether a file was deleted)
     */
    public boolean remove(ArchiveEntry entry) throws ArchiveException {
        Path file = archiveDir.resolve(entry.getFileName());
        try {
            boolean deleted = Files.deleteIfExists(file);
            if (deleted) {
                log.info("归档已删除 / Archive removed: {}", entry.getFileName());
            }
            return deleted;
        } catch (IOException e) {
            throw new ArchiveException(HitSetErrorCode.ARCHIVE_SAVE_FAILED, "删除失败 / Remove failed: " + file, e);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("临时文件清理失败 / Failed to clean up temp file: {}", file, e);
        }
    }
}
