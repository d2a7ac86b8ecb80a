package io.github.vevoly.hitset.api.exception;

/**
 * <h3>输入格式错误异常</h3>
 *
 * <p>解码时遇到未知类型标签、数据截断或信封版本不兼容时抛出。</p>
 *
 * <hr>
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Malformed input exception.</b><br>
 * Thrown when decoding meets an unknown type tag, a truncated buffer or an envelope past its compat version.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class MalformedInputException extends HitSetException {
    public MalformedInputException(String message) {
        super(HitSetErrorCode.MALFORMED_INPUT, message);
    }
    public MalformedInputException(String message, Throwable cause) {
        super(HitSetErrorCode.MALFORMED_INPUT, message, cause);
    }
}
