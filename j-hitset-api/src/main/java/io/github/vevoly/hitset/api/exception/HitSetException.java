package io.github.vevoly.hitset.api.exception;

import java.util.Objects;

/**
 * <h3>命中集异常基类 (Base HitSet Exception)</h3>
 *
 * <p>所有由本库抛出的、可由调用方处理的异常都应继承此类。编程错误（前置条件不满足）不走此体系，直接抛出非受检异常。</p>
 *
 * <hr>
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Base exception for recoverable HitSet failures.</b><br>
 * Programming errors (violated preconditions) are not part of this hierarchy; they surface as unchecked exceptions.
 * Every instance carries a {@link HitSetErrorCode}, which {@link #toString()} prints ahead of the message,
 * e.g. {@code MalformedInputException[2001 MALFORMED_INPUT]: truncated envelope}.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class HitSetException extends Exception {

    private final HitSetErrorCode errorCode;

    public HitSetException(HitSetErrorCode errorCode) {
        this(errorCode, errorCode.getDefaultMessage());
    }

    public HitSetException(HitSetErrorCode errorCode, String message) {
        super(message);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode");
    }

    public HitSetException(HitSetErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode");
    }

    public HitSetErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * 数字错误码，便于日志检索 / Numeric error code, handy for log searches
     */
    public int getCode() {
        return errorCode.getCode();
    }

    @Override
    public String toString() {
        String message = getLocalizedMessage();
        String head = getClass().getSimpleName() + "[" + errorCode.getCode() + " " + errorCode.name() + "]";
        return message == null ? head : head + ": " + message;
    }
}
