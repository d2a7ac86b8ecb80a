package io.github.vevoly.hitset.core.archive;

import com.google.common.base.Preconditions;
import io.github.vevoly.hitset.api.constants.HitSetConstant;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Optional;

/**
 * <h3>归档条目 (Archive Entry)</h3>
 *
 * <p>
 * 标识一个已归档的命中集：分片名与跟踪周期 {@code [begin, end]}（毫秒时间戳）。
 * 文件名格式：{@code hit_set_<shard>_archive_<begin>_<end>}。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * Identifies one archived hit set by shard and interval {@code [begin, end]} in epoch millis.
 * File name: {@code hit_set_<shard>_archive_<begin>_<end>}.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode
@ToString
public final class ArchiveEntry implements Comparable<ArchiveEntry> {

    private final String shard;
    private final long begin;
    private final long end;

    public ArchiveEntry(String shard, long begin, long end) {
        Preconditions.checkArgument(shard != null && !shard.isEmpty(), "shard must not be empty");
        Preconditions.checkArgument(shard.indexOf('/') < 0 && shard.indexOf('\\') < 0,
                "shard must not contain path separators: %s", shard);
        Preconditions.checkArgument(begin >= 0 && end >= begin, "invalid interval [%s, %s]", begin, end);
        this.shard = shard;
        this.begin = begin;
        this.end = end;
    }

    public String getFileName() {
        return HitSetConstant.ARCHIVE_FILE_PREFIX + shard + HitSetConstant.ARCHIVE_MARK + begin + "_" + end;
    }

    /**
     * 解析归档文件名，不符合格式时返回空.
     * <br>
     * <span style="color: gray;">Parses an archive file name; empty when it does not match.</span>
     */
    public static Optional<ArchiveEntry> parse(String fileName) {
        if (fileName == null || !fileName.startsWith(HitSetConstant.ARCHIVE_FILE_PREFIX)) {
            return Optional.empty();
        }
        int mark = fileName.lastIndexOf(HitSetConstant.ARCHIVE_MARK);
        if (mark <= HitSetConstant.ARCHIVE_FILE_PREFIX.length()) {
            return Optional.empty();
        }
        String shard = fileName.substring(HitSetConstant.ARCHIVE_FILE_PREFIX.length(), mark);
        String[] interval = fileName.substring(mark + HitSetConstant.ARCHIVE_MARK.length()).split("_");
        if (interval.length != 2) {
            return Optional.empty();
        }
        try {
            long begin = Long.parseLong(interval[0]);
            long end = Long.parseLong(interval[1]);
            if (begin < 0 || end < begin) {
                return Optional.empty();
            }
            return Optional.of(new ArchiveEntry(shard, begin, end));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    @Override
    public int compareTo(ArchiveEntry other) {
        int byShard = shard.compareTo(other.shard);
        if (byShard != 0) {
            return byShard;
        }
        int byBegin = Long.compare(begin, other.begin);
        return byBegin != 0 ? byBegin : Long.compare(end, other.end);
    }
}
