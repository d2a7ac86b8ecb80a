package io.github.vevoly.hitset.api.exception;

/**
 * <h3>命中集错误码 (HitSet Error Codes)</h3>
 *
 * <p>定义了命中集编解码、归档与装配过程中可能抛出的标准异常代码。</p>
 *
 * <hr>
 * <span style="color: gray; font-size: 0.9em;">
 * <b>HitSet Error Codes.</b><br>
 * Defines the standard codes raised while encoding, decoding, archiving and wiring hit sets.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public enum HitSetErrorCode {

    // --- 1xxx: 初始化与配置错误 (Initialization & Configuration) ---
    INITIALIZATION_FAILED(1001, "HitSet configuration is invalid"),

    // --- 2xxx: 编解码错误 (Codec) ---
    MALFORMED_INPUT(2001, "Malformed HitSet input"),

    // --- 3xxx: 归档错误 (Archive) ---
    ARCHIVE_SAVE_FAILED(3001, "Failed to save HitSet archive"),
    ARCHIVE_LOAD_FAILED(3002, "Failed to load HitSet archive"),

    ;

    private final int code;
    private final String defaultMessage;

    HitSetErrorCode(int code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public int getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
