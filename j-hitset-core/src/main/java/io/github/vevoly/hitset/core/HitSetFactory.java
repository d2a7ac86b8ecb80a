package io.github.vevoly.hitset.core;

import com.google.common.base.Preconditions;
import io.github.vevoly.hitset.core.params.HitSetParams;
import lombok.extern.slf4j.Slf4j;

/**
 * <h3>命中集工厂 (Hit Set Factory)</h3>
 *
 * <p>
 * 持有一份配置的私有副本，每个跟踪周期调用 {@link #create()} 得到一个新的空命中集。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Hit Set Factory.</b><br>
 * Keeps a private copy of the parameters and hands out a fresh, empty hit set per tracking interval.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Slf4j
public class HitSetFactory {

    private final HitSetParams params;

    public HitSetFactory(HitSetParams params) {
        Preconditions.checkNotNull(params, "params");
        this.params = HitSetParams.createCopy(params);
        log.info("命中集工厂就绪 / Hit set factory ready: {}", this.params);
    }

    /**
     * 创建新的命中集 / A fresh hit set for the next interval
     */
    public HitSet create() {
        return new HitSet(params);
    }

    /**
     * 配置副本 / A copy of the configured parameters
     */
    public HitSetParams getParams() {
        return params.copy();
    }
}
