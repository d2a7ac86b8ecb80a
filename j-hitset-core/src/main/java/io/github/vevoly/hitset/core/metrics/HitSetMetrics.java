package io.github.vevoly.hitset.core.metrics;

import com.google.common.base.Preconditions;
import io.github.vevoly.hitset.api.constants.HitSetConstant;
import io.github.vevoly.hitset.core.HitSet;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * <h3>监控指标 (Hit Set Metrics)</h3>
 *
 * <p>把命中集计数以及归档写入量暴露给 Micrometer (Prometheus/Grafana)。
 * Gauge 只读取所属线程发布的计数快照，不读取命中集本身。</p>
 * <ul>
 *     <li>{@code <prefix>insert.count} / {@code <prefix>unique.count}: Gauge，标签 shard、type。</li>
 *     <li>{@code <prefix>archive.saved}: Counter，{@code <prefix>archive.bytes}: DistributionSummary，标签 shard。</li>
 * </ul>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Hit Set Metrics.</b><br>
 * Exposes hit set counters and archive volume to Micrometer.
 * Gauges never touch a {@link HitSet}: the owning thread publishes a count snapshot through
 * {@link #bind(String, HitSet)} and the scrape thread only reads that snapshot.
 * One gauge pair exists per shard; a type change replaces it.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Slf4j
public class HitSetMetrics {

    // 标签名称 / Label names
    public static final String TAG_SHARD = "shard";
    public static final String TAG_TYPE = "type";

    // 指标名称 / Metric names
    private final String insertCount;
    private final String uniqueCount;
    private final String archiveSaved;
    private final String archiveBytes;

    private final MeterRegistry registry;

    // 每个分片一组 Gauge，Map 强引用持有快照 / One gauge pair per shard, held strongly here
    private final Map<String, ShardGauges> shards = new ConcurrentHashMap<>();

    public HitSetMetrics(MeterRegistry registry, String prefix) {
        Preconditions.checkNotNull(registry, "registry");
        if (prefix == null || prefix.trim().isEmpty()) {
            prefix = HitSetConstant.DEFAULT_METRICS_PREFIX;
        }
        if (!prefix.endsWith(".")) {
            prefix += ".";
        }
        this.registry = registry;
        this.insertCount = prefix + "insert.count";
        this.uniqueCount = prefix + "unique.count";
        this.archiveSaved = prefix + "archive.saved";
        this.archiveBytes = prefix + "archive.bytes";
    }

    /**
     * 发布分片命中集的计数快照.
     * <p>必须由持有该命中集的线程在两次写入之间调用；Gauge 看到的是最近一次发布时的计数。
     * 类型变化时移除旧的 Gauge 再注册新的。</p>
     * <span style="color: gray;">Publishes a count snapshot of the shard's hit set.
     * Call it from the thread that owns the set, between inserts; gauges report the counts as of the latest call.
     * A type change removes the old gauges before registering new ones.</span>
     */
    public void bind(String shard, HitSet hitSet) {
        Preconditions.checkNotNull(shard, "shard");
        Preconditions.checkNotNull(hitSet, "hit set");
        String type = hitSet.getTypeName();
        long inserts = count(hitSet, false);
        long unique = count(hitSet, true);
        shards.compute(shard, (key, current) -> {
            if (current != null && current.type.equals(type)) {
                current.publish(inserts, unique);
                return current;
            }
            if (current != null) {
                log.debug("分片类型变化，替换 Gauge / Shard {} switched type {} -> {}, replacing gauges", key, current.type, type);
                current.unregister(registry);
            }
            ShardGauges created = new ShardGauges(type);
            created.publish(inserts, unique);
            created.register(registry, Tags.of(TAG_SHARD, key, TAG_TYPE, type));
            return created;
        });
    }

    /**
     * 移除分片的 Gauge / Remove the shard's gauges
     */
    public void unbind(String shard) {
        ShardGauges removed = shards.remove(shard);
        if (removed != null) {
            removed.unregister(registry);
        }
    }

    private static long count(HitSet hitSet, boolean unique) {
        if (!hitSet.isTracking()) {
            return 0;
        }
        return unique ? hitSet.approxUniqueInsertCount() : hitSet.insertCount();
    }

    /**
     * 记录一次归档写入 / Record one archive write
     */
    public void recordArchived(String shard, int bytes) {
        Tags tags = Tags.of(TAG_SHARD, shard);
        registry.counter(archiveSaved, tags).increment();
        DistributionSummary.builder(archiveBytes)
                .baseUnit("bytes")
                .tags(tags)
                .register(registry)
                .record(bytes);
    }

    public String getInsertCountName() {
        return insertCount;
    }

    public String getUniqueCountName() {
        return uniqueCount;
    }

    public String getArchiveSavedName() {
        return archiveSaved;
    }

    public String getArchiveBytesName() {
        return archiveBytes;
    }

    private final class ShardGauges {
        private final String type;
        private final AtomicLong inserts = new AtomicLong();
        private final AtomicLong unique = new AtomicLong();
        private Gauge insertGauge;
        private Gauge uniqueGauge;

        private ShardGauges(String type) {
            this.type = type;
        }

        private void publish(long insertValue, long uniqueValue) {
            inserts.set(insertValue);
            unique.set(uniqueValue);
        }

        private void register(MeterRegistry registry, Tags tags) {
            insertGauge = Gauge.builder(insertCount, inserts, AtomicLong::get).tags(tags).register(registry);
            uniqueGauge = Gauge.builder(uniqueCount, unique, AtomicLong::get).tags(tags).register(registry);
        }

        private void unregister(MeterRegistry registry) {
            registry.remove(insertGauge);
            registry.remove(uniqueGauge);
        }
    }
}
