package io.github.vevoly.hitset.core.params;

import com.google.gson.JsonObject;
import io.github.vevoly.hitset.api.HitTracker;
import io.github.vevoly.hitset.api.codec.WireInput;
import io.github.vevoly.hitset.api.codec.WireOutput;
import io.github.vevoly.hitset.api.constants.HitSetConstant;
import io.github.vevoly.hitset.api.constants.HitSetType;
import io.github.vevoly.hitset.api.exception.MalformedInputException;
import io.github.vevoly.hitset.core.tracker.BloomHitTracker;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

/**
 * <h3>布隆过滤器配置 (Bloom Filter Parameters)</h3>
 *
 * <p>
 * 误判率在线路上以 <b>定点数</b> 存储：{@code u16 round(fpp × 1,000,000)}，分辨率为百万分之一。
 * 超过 16 位可表示范围（即 fpp &gt; 0.065535）的值会被截断为 65535，低于分辨率的正值按 1 编码，两者都记录 WARN 日志；
 * 解码时除以同一比例因子还原。
 * </p>
 * <ul>
 *     <li><b>falsePositive:</b> 目标误判率，默认 {@value HitSetConstant#DEFAULT_BLOOM_FALSE_POSITIVE}。</li>
 *     <li><b>targetSize:</b> 预计唯一插入数，决定初始位表大小。</li>
 *     <li><b>seed:</b> 哈希种子，0 表示使用过滤器默认种子。</li>
 * </ul>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Bloom Filter Parameters.</b><br>
 * The false positive rate is stored as fixed point on the wire: {@code u16 round(fpp × 1,000,000)}.
 * Rates above 0.065535 are saturated to 65535 and positive rates below the resolution are raised to 1, both logged
 * at WARN, so a decoded rate is never 0 unless the configured one was. Decoding divides by the same factor.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Slf4j
@Getter
@Setter
@EqualsAndHashCode(callSuper = false)
public class BloomParams extends HitSetParams {

    private static final int STRUCT_VERSION = 1;

    /**
     * 定点比例因子 / Fixed-point scale of the false positive rate
     */
    public static final double FPP_SCALE = 1_000_000.0;

    private static final int FPP_MAX_MICROS = 0xFFFF;

    /**
     * 线路可表示的最大误判率 / Largest rate the wire form can carry
     */
    public static final double MAX_ENCODABLE_FALSE_POSITIVE = FPP_MAX_MICROS / FPP_SCALE;

    /**
     * 线路可表示的最小正误判率 / Smallest positive rate the wire form can carry
     */
    public static final double MIN_ENCODABLE_FALSE_POSITIVE = 1 / FPP_SCALE;

    private double falsePositive;
    private long targetSize;
    private long seed;

    public BloomParams() {
        this(HitSetConstant.DEFAULT_BLOOM_FALSE_POSITIVE, HitSetConstant.DEFAULT_BLOOM_TARGET_SIZE,
                HitSetConstant.DEFAULT_BLOOM_SEED);
    }

    /**
     * 构造函数 (Constructor).
     *
     * @param falsePositive 目标误判率 (Target false positive rate)
     * @param targetSize    预计唯一插入数 (Expected unique insertions)
     * @param seed          哈希种子 (Hash seed)
     */
    public BloomParams(double falsePositive, long targetSize, long seed) {
        this.falsePositive = falsePositive;
        this.targetSize = targetSize;
        this.seed = seed;
    }

    @Override
    public HitSetType getType() {
        return HitSetType.BLOOM;
    }

    @Override
    public HitSetParams copy() {
        return new BloomParams(falsePositive, targetSize, seed);
    }

    /**
     * @throws IllegalArgumentException 误判率不在 (0, 1) 或 targetSize &lt;= 0 (Rate outside (0, 1) or non-positive size)
     */
    @Override
    public HitTracker newTracker() {
        return new BloomHitTracker(targetSize, falsePositive, seed);
    }

    /**
     * 误判率的定点表示 (Fixed-point Rate).
     *
     * @return {@code round(fpp × 1e6)}，截断到 [0, 65535]，正值至少为 1 (Clamped to [0, 65535], at least 1 for a positive rate)
     */
    public int falsePositiveMicros() {
        long micros = Math.round(falsePositive * FPP_SCALE);
        if (micros > FPP_MAX_MICROS) {
            log.warn("误判率超出定点范围，已截断 / False positive rate {} exceeds fixed-point range, saturated to {}",
                    falsePositive, FPP_MAX_MICROS);
            return FPP_MAX_MICROS;
        }
        if (micros < 0) {
            log.warn("误判率为负数，按 0 编码 / Negative false positive rate {} encoded as 0", falsePositive);
            return 0;
        }
        if (micros == 0 && falsePositive > 0.0) {
            // 0 无法再构建过滤器 / A zero rate cannot build a filter again
            log.warn("误判率低于定点分辨率，按最小值编码 / False positive rate {} below fixed-point resolution, raised to {}",
                    falsePositive, MIN_ENCODABLE_FALSE_POSITIVE);
            return 1;
        }
        return (int) micros;
    }

    @Override
    protected void encodePayload(WireOutput out) {
        int micros = falsePositiveMicros();
        out.writeEnvelope(STRUCT_VERSION, STRUCT_VERSION, body -> body
                .writeU16(micros)
                .writeU64(targetSize)
                .writeU64(seed));
    }

    @Override
    protected void decodePayload(WireInput in) throws MalformedInputException {
        in.readEnvelope(STRUCT_VERSION, (body, structVersion) -> {
            int micros = body.readU16();
            long decodedTarget = body.readU64();
            long decodedSeed = body.readU64();
            falsePositive = micros / FPP_SCALE;
            targetSize = decodedTarget;
            seed = decodedSeed;
        });
    }

    @Override
    protected void dumpParams(JsonObject json) {
        json.addProperty("false_positive_probability", falsePositive);
        json.addProperty("target_size", targetSize);
        json.addProperty("seed", seed);
    }
}
