package io.github.vevoly.hitset.api.exception;

/**
 * <h3>归档异常</h3>
 *
 * <p>当命中集归档文件写入或读取失败时抛出。</p>
 *
 * <hr>
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Archive exception.</b><br>
 * Thrown when an archived hit set file cannot be written or read back.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class ArchiveException extends HitSetException {
    public ArchiveException(HitSetErrorCode errorCode, String message) {
        super(errorCode, message);
    }
    public ArchiveException(HitSetErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
