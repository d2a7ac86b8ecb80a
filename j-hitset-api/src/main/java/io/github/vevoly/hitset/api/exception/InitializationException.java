package io.github.vevoly.hitset.api.exception;

/**
 * <h3>初始化异常</h3>
 *
 * <p>当配置项校验失败、无法构造命中集参数时抛出。</p>
 *
 * <hr>
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Initialization exception.</b><br>
 * Thrown when configuration validation fails and no HitSet params can be built.
 * When raised for a single setting, {@link #getProperty()} names it.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class InitializationException extends HitSetException {

    private final String property;

    public InitializationException(String message) {
        this(null, message, (Throwable) null);
    }

    public InitializationException(String message, Throwable cause) {
        this(null, message, cause);
    }

    private InitializationException(String property, String message, Throwable cause) {
        super(HitSetErrorCode.INITIALIZATION_FAILED, message, cause);
        this.property = property;
    }

    /**
     * 某个配置项取值非法.
     * <br>
     * <span style="color: gray;">A single setting holds an unusable value; the message reads {@code property=value: constraint}.</span>
     *
     * @param property   配置项全名 (Fully qualified property name)
     * @param value      实际取值 (Offending value)
     * @param constraint 约束描述 (What the value must satisfy)
     */
    public static InitializationException invalidProperty(String property, Object value, String constraint) {
        return new InitializationException(property, property + "=" + value + ": " + constraint, null);
    }

    /**
     * @return 出错的配置项，未指明时为 {@code null} (Offending property, or {@code null} when not tied to one)
     */
    public String getProperty() {
        return property;
    }
}
