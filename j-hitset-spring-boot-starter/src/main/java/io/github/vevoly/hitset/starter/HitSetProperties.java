package io.github.vevoly.hitset.starter;

import io.github.vevoly.hitset.api.constants.HitSetConstant;
import io.github.vevoly.hitset.api.constants.HitSetType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * <h3>命中集配置属性 (Hit Set Configuration Properties)</h3>
 *
 * <p>
 * 对应 {@code application.yml} 中的配置项。前缀为 <b>j-hitset</b>。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Hit Set Configuration Properties.</b><br>
 * Maps to configuration items in {@code application.yml}. Prefix: <b>j-hitset</b>.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Data
@ConfigurationProperties(prefix = HitSetConstant.J_HITSET_ID)
public class HitSetProperties {

    /**
     * 跟踪策略类型 (Tracking Strategy Type).
     * <p>默认为布隆过滤器 (BLOOM)。</p>
     * <span style="color: gray;">Default: BLOOM.</span>
     */
    private HitSetType type = HitSetConstant.DEFAULT_TYPE;

    /**
     * 布隆过滤器参数，仅 type=BLOOM 时生效 / Bloom settings, only used when type=BLOOM
     */
    private Bloom bloom = new Bloom();

    private Archive archive = new Archive();

    /**
     * 监控指标的前缀 (Metrics Prefix).
     * <p>默认为 "j-hitset."</p>
     * <span style="color: gray;">Metrics prefix. Default: "j-hitset.".</span>
     */
    private String metricsPrefix = HitSetConstant.DEFAULT_METRICS_PREFIX;

    @Data
    public static class Bloom {

        /**
         * 目标误判率，取值 (0, 1)；线路上的分辨率为百万分之一，超过 0.065535 时编码会被截断.
         * <br>
         * <span style="color: gray;">Target false positive rate in (0, 1). Encoded in micro-units, saturating above 0.065535.</span>
         */
        private double falsePositive = HitSetConstant.DEFAULT_BLOOM_FALSE_POSITIVE;

        /**
         * 每个周期预计的唯一访问数 / Expected unique hits per interval
         */
        private long targetSize = HitSetConstant.DEFAULT_BLOOM_TARGET_SIZE;

        /**
         * 哈希种子，0 表示默认种子 / Hash seed, 0 selects the default
         */
        private long seed = HitSetConstant.DEFAULT_BLOOM_SEED;
    }

    @Data
    public static class Archive {

        /**
         * 归档根目录 (Archive Base Directory).
         * <p>配置后才会创建归档 Bean。</p>
         * <span style="color: gray;">The archive bean is only created when this is set. e.g., /data/hitset</span>
         */
        private String baseDir;
    }
}
