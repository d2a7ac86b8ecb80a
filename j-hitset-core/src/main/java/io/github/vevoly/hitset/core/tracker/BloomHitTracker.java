package io.github.vevoly.hitset.core.tracker;

import com.google.gson.JsonObject;
import io.github.vevoly.hitset.api.HObject;
import io.github.vevoly.hitset.api.HitTracker;
import io.github.vevoly.hitset.api.codec.WireInput;
import io.github.vevoly.hitset.api.codec.WireOutput;
import io.github.vevoly.hitset.api.constants.HitSetType;
import io.github.vevoly.hitset.api.exception.MalformedInputException;
import io.github.vevoly.hitset.core.bloom.CompressibleBloomFilter;
import lombok.extern.slf4j.Slf4j;

/**
 * <h3>布隆过滤器策略 (Bloom Filter Strategy)</h3>
 *
 * <p>
 * 基于 {@link CompressibleBloomFilter} 的概率型策略，以对象的 32 位哈希作为插入值。
 * </p>
 * <ul>
 *     <li><b>优点：</b> 内存占用极低，周期结束后还可按密度压缩。</li>
 *     <li><b>缺点：</b> 存在误判 (False Positive)，哈希冲突的对象无法区分；去重计数只是估算。</li>
 * </ul>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Bloom Filter Strategy.</b><br>
 * Probabilistic strategy over {@link CompressibleBloomFilter}, keyed by the object's 32-bit hash.<br>
 * <b>Pros:</b> very low memory, can be compressed by density once the interval ends.<br>
 * <b>Cons:</b> false positives, colliding hashes are indistinguishable, unique count is an estimate.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Slf4j
public class BloomHitTracker implements HitTracker {

    private static final int STRUCT_VERSION = 1;

    private final CompressibleBloomFilter bloom;

    /**
     * 无参构造函数 (No-Arg Constructor).
     * <p>过滤器未分配位表，仅作为解码目标。</p>
     * <span style="color: gray;">The filter has no bit table; only used as a decode target.</span>
     */
    public BloomHitTracker() {
        this.bloom = new CompressibleBloomFilter();
    }

    /**
     * 构造函数 (Constructor).
     *
     * @param targetSize    预计唯一插入数 (Expected unique insertions)
     * @param falsePositive 目标误判率 (Target false positive rate)
     * @param seed          哈希种子 (Hash seed)
     */
    public BloomHitTracker(long targetSize, double falsePositive, long seed) {
        this.bloom = new CompressibleBloomFilter(targetSize, falsePositive, seed);
    }

    private BloomHitTracker(CompressibleBloomFilter bloom) {
        this.bloom = bloom;
    }

    @Override
    public HitSetType getType() {
        return HitSetType.BLOOM;
    }

    @Override
    public void insert(HObject object) {
        bloom.insert(object.getHash());
    }

    @Override
    public boolean contains(HObject object) {
        return bloom.contains(object.getHash());
    }

    @Override
    public long insertCount() {
        return bloom.elementCount();
    }

    @Override
    public long approxUniqueInsertCount() {
        return bloom.approxUniqueElementCount();
    }

    /**
     * <h3>按密度压缩 (Density Based Compression)</h3>
     * <p>
     * 目标密度 50%：若 {@code 密度 × 2 × 100 < 100}，将位表压缩到该百分比。已经较满的过滤器保持不变。
     * 只应在周期结束、持久化之前调用一次，之后不应再插入。
     * </p>
     *
     * <hr>
     * <span style="color: gray; font-size: 0.9em;">
     * Aims at 50% density: when {@code density × 2 × 100 < 100} the table is compressed to that percentage.
     * A fuller filter is left alone. Call once after the interval ends and before persisting.
     * </span>
     */
    @Override
    public void optimize() {
        double percent = bloom.density() * 2 * 100;
        if (percent >= 100) {
            log.debug("密度过高，跳过压缩 / Bloom density too high, not compressing: {}%", percent);
            return;
        }
        int before = bloom.getTableSize();
        boolean compressed = bloom.compress(percent);
        log.debug("布隆过滤器压缩 / Bloom compress to {}%: {} -> {} bytes (applied={})",
                percent, before, bloom.getTableSize(), compressed);
    }

    @Override
    public void encode(WireOutput out) {
        out.writeEnvelope(STRUCT_VERSION, STRUCT_VERSION, bloom::encode);
    }

    @Override
    public void decode(WireInput in) throws MalformedInputException {
        in.readEnvelope(STRUCT_VERSION, (body, structVersion) -> bloom.decode(body));
    }

    @Override
    public void dump(JsonObject json) {
        JsonObject filter = new JsonObject();
        bloom.dump(filter);
        json.add("bloom_filter", filter);
    }

    @Override
    public HitTracker copy() {
        return new BloomHitTracker(bloom.copy());
    }

    /**
     * 内部过滤器（只读诊断）/ Underlying filter, for diagnostics
     */
    public CompressibleBloomFilter getBloomFilter() {
        return bloom;
    }
}
