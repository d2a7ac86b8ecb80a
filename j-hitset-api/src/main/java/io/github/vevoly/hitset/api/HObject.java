package io.github.vevoly.hitset.api;

import com.google.common.base.Preconditions;
import com.google.common.collect.ComparisonChain;
import com.google.gson.JsonObject;
import io.github.vevoly.hitset.api.codec.WireInput;
import io.github.vevoly.hitset.api.codec.WireOutput;
import io.github.vevoly.hitset.api.exception.MalformedInputException;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * <h3>对象标识 (Object Identity)</h3>
 *
 * <p>
 * 命中集中的键。对跟踪策略而言它是不透明的：只用到 {@link #getHash()}（32 位放置哈希）与完整标识的相等性。
 * 排序规则：pool → hash(无符号) → namespace → key → oid → snap。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Object Identity.</b><br>
 * The key tracked by a hit set. Tracking strategies only use {@link #getHash()} (the 32-bit placement hash)
 * and full-identity equality. Ordering: pool, hash (unsigned), namespace, key, oid, snap.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode
@ToString
@AllArgsConstructor
public final class HObject implements Comparable<HObject> {

    /**
     * 头版本（非快照）的 snap 值 / Snap id of the head (non-snapshot) object
     */
    public static final long NOSNAP = -2L;

    private static final int STRUCT_VERSION = 1;

    /**
     * 所属存储池 / Owning pool
     */
    private final long pool;

    @NonNull
    private final String namespace;

    /**
     * 定位键 / Locator key
     */
    @NonNull
    private final String key;

    /**
     * 对象名 / Object name
     */
    @NonNull
    private final String oid;

    /**
     * 快照 id，按无符号 64 位解释 / Snapshot id, unsigned 64-bit
     */
    private final long snap;

    /**
     * 32 位放置哈希 / 32-bit placement hash
     */
    private final int hash;

    /**
     * 默认池、空命名空间、头版本对象 / Head object in pool 0 with an empty namespace
     */
    public static HObject of(String oid, int hash) {
        return new HObject(0L, "", "", oid, NOSNAP, hash);
    }

    @Override
    public int compareTo(HObject other) {
        return ComparisonChain.start()
                .compare(pool, other.pool)
                .compare(hash, other.hash, Integer::compareUnsigned)
                .compare(namespace, other.namespace)
                .compare(key, other.key)
                .compare(oid, other.oid)
                .compare(snap, other.snap, Long::compareUnsigned)
                .result();
    }

    public void encode(WireOutput out) {
        out.writeEnvelope(STRUCT_VERSION, STRUCT_VERSION, body -> body
                .writeString(key)
                .writeString(oid)
                .writeU64(snap)
                .writeU32(Integer.toUnsignedLong(hash))
                .writeString(namespace)
                .writeU64(pool));
    }

    public static HObject decode(WireInput in) throws MalformedInputException {
        return in.decodeEnvelope(STRUCT_VERSION, (body, structVersion) -> {
            String key = body.readString();
            String oid = body.readString();
            long snap = body.readU64();
            int hash = (int) body.readU32();
            String namespace = body.readString();
            long pool = body.readU64();
            return new HObject(pool, namespace, key, oid, snap, hash);
        });
    }

    public void dump(JsonObject json) {
        Preconditions.checkNotNull(json, "json");
        json.addProperty("oid", oid);
        json.addProperty("key", key);
        json.addProperty("snap", snap == NOSNAP ? "head" : Long.toUnsignedString(snap));
        json.addProperty("hash", Integer.toUnsignedLong(hash));
        json.addProperty("pool", pool);
        json.addProperty("namespace", namespace);
    }
}
