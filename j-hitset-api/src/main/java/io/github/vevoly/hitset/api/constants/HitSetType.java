package io.github.vevoly.hitset.api.constants;

import java.util.Optional;

/**
 * <h3>命中集类型标签 (HitSet Type Tag)</h3>
 *
 * <p>
 * 随载荷一起写入线路格式的类型标签。标签集合是封闭的，编码值一经发布不可更改。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>HitSet Type Tag.</b><br>
 * The tag written ahead of every payload. The set is closed; published codes never change.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public enum HitSetType {

    /**
     * 空类型，不持有任何跟踪策略 / No tracking strategy
     */
    NONE(0, "none"),

    /**
     * 显式记录 32 位哈希值 / Explicit set of 32-bit hashes
     */
    EXPLICIT_HASH(1, "explicit_hash"),

    /**
     * 显式记录完整对象标识 / Explicit set of full object identities
     */
    EXPLICIT_OBJECT(2, "explicit_object"),

    /**
     * <b>可压缩布隆过滤器 (Compressible Bloom Filter)</b>
     * <br>
     * 省内存，但存在误判，唯一计数为估算值。
     * <br>
     * <span style="color: gray;">Compact, allows false positives, unique count is an estimate.</span>
     */
    BLOOM(3, "bloom");

    private final int code;
    private final String typeName;

    HitSetType(int code, String typeName) {
        this.code = code;
        this.typeName = typeName;
    }

    /**
     * 线路格式中的标签值 / Tag value on the wire
     */
    public int getCode() {
        return code;
    }

    public String getTypeName() {
        return typeName;
    }

    /**
     * 根据标签值查找类型 (Lookup by code).
     *
     * @param code 标签值 (Tag value)
     * @return 对应类型；未知标签返回空 (Matching type, empty for unknown codes)
     */
    public static Optional<HitSetType> fromCode(int code) {
        for (HitSetType type : values()) {
            if (type.code == code) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
