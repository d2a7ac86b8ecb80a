package io.github.vevoly.hitset.starter;

import io.github.vevoly.hitset.api.constants.HitSetConstant;
import io.github.vevoly.hitset.api.constants.HitSetType;
import io.github.vevoly.hitset.api.exception.InitializationException;
import io.github.vevoly.hitset.core.HitSetFactory;
import io.github.vevoly.hitset.core.archive.HitSetArchive;
import io.github.vevoly.hitset.core.metrics.HitSetMetrics;
import io.github.vevoly.hitset.core.params.BloomParams;
import io.github.vevoly.hitset.core.params.HitSetParams;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * <h3>命中集自动装配类 (Hit Set Auto-Configuration)</h3>
 *
 * <p>
 * 根据配置文件组装默认的 {@link HitSetParams}、{@link HitSetFactory}，
 * 并在配置了归档目录 / 存在 {@link MeterRegistry} 时分别装配 {@link HitSetArchive} 与 {@link HitSetMetrics}。
 * 用户自定义的同类型 Bean 优先。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Hit Set Auto-Configuration.</b><br>
 * Builds the default {@link HitSetParams} and {@link HitSetFactory} from configuration, plus
 * {@link HitSetArchive} when an archive directory is set and {@link HitSetMetrics} when a {@link MeterRegistry} exists.
 * User-defined beans of the same type win.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Slf4j
@AutoConfiguration(afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@EnableConfigurationProperties(HitSetProperties.class)
public class HitSetAutoConfiguration {

    /**
     * 初始化默认配置 (Initialize Default Parameters).
     * <p>
     * 如果用户没有自定义 {@link HitSetParams} Bean，则根据配置文件创建。
     * </p>
     *
     * @throws InitializationException 布隆参数非法 (Invalid bloom settings)
     */
    @Bean
    @ConditionalOnMissingBean(HitSetParams.class)
    public HitSetParams defaultHitSetParams(HitSetProperties props) throws InitializationException {
        HitSetType type = props.getType() == null ? HitSetConstant.DEFAULT_TYPE : props.getType();
        if (type != HitSetType.BLOOM) {
            return HitSetParams.forType(type);
        }
        HitSetProperties.Bloom bloom = props.getBloom();
        if (!(bloom.getFalsePositive() > 0.0 && bloom.getFalsePositive() < 1.0)) {
            throw InitializationException.invalidProperty("j-hitset.bloom.false-positive", bloom.getFalsePositive(),
                    "必须在 (0, 1) 之间 / must be in (0, 1)");
        }
        if (bloom.getTargetSize() <= 0) {
            throw InitializationException.invalidProperty("j-hitset.bloom.target-size", bloom.getTargetSize(),
                    "必须大于 0 / must be > 0");
        }
        if (bloom.getFalsePositive() > BloomParams.MAX_ENCODABLE_FALSE_POSITIVE) {
            log.warn("配置的误判率超出线路可表示范围，持久化后将变小 / Configured false positive rate {} will shrink once encoded",
                    bloom.getFalsePositive());
        }
        return new BloomParams(bloom.getFalsePositive(), bloom.getTargetSize(), bloom.getSeed());
    }

    @Bean
    @ConditionalOnMissingBean(HitSetFactory.class)
    public HitSetFactory hitSetFactory(HitSetParams params) {
        return new HitSetFactory(params);
    }

    /**
     * 监控指标，仅当存在 {@link MeterRegistry} 时装配 / Metrics, only with a {@link MeterRegistry}
     */
    @Bean
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnMissingBean(HitSetMetrics.class)
    public HitSetMetrics hitSetMetrics(MeterRegistry registry, HitSetProperties props) {
        return new HitSetMetrics(registry, props.getMetricsPrefix());
    }

    /**
     * 归档存储，仅当配置了 {@code j-hitset.archive.base-dir} 时装配.
     * <br>
     * <span style="color: gray;">Archive store, only when {@code j-hitset.archive.base-dir} is set.</span>
     */
    @Bean
    @ConditionalOnMissingBean(HitSetArchive.class)
    @ConditionalOnProperty(name = HitSetConstant.META_ARCHIVE_BASE_DIR)
    public HitSetArchive hitSetArchive(HitSetProperties props, ObjectProvider<HitSetMetrics> metricsProvider) {
        // 尝试获取 Bean，如果没有则返回 null / Try to get the bean, null if absent
        HitSetMetrics metrics = metricsProvider.getIfAvailable();
        log.info("命中集归档目录 / Hit set archive base dir: {}", props.getArchive().getBaseDir());
        return new HitSetArchive(props.getArchive().getBaseDir(), metrics);
    }
}
