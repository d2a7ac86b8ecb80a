package io.github.vevoly.hitset.core.tracker;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import io.github.vevoly.hitset.api.HObject;
import io.github.vevoly.hitset.api.HitTracker;
import io.github.vevoly.hitset.api.codec.WireInput;
import io.github.vevoly.hitset.api.codec.WireOutput;
import io.github.vevoly.hitset.api.constants.HitSetType;
import io.github.vevoly.hitset.api.exception.MalformedInputException;

import java.util.HashSet;
import java.util.Set;

/**
 * <h3>显式哈希集合策略 (Explicit Hash Strategy)</h3>
 *
 * <p>
 * 只记录对象的 32 位放置哈希。哈希相同的不同对象视为同一个。
 * </p>
 * <ul>
 *     <li><b>优点：</b> 去重计数精确，内存占用比存储完整对象小。</li>
 *     <li><b>缺点：</b> 内存随唯一哈希数线性增长。</li>
 * </ul>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Explicit Hash Strategy.</b><br>
 * Records only the 32-bit placement hash; distinct objects sharing a hash count as one.<br>
 * <b>Pros:</b> exact unique count, smaller than storing full identities.<br>
 * <b>Cons:</b> memory grows linearly with unique hashes.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class ExplicitHashHitTracker implements HitTracker {

    private static final int STRUCT_VERSION = 1;

    private long count;
    private final Set<Integer> hashes;

    public ExplicitHashHitTracker() {
        this.hashes = new HashSet<>();
    }

    private ExplicitHashHitTracker(ExplicitHashHitTracker other) {
        this.count = other.count;
        this.hashes = new HashSet<>(other.hashes);
    }

    @Override
    public HitSetType getType() {
        return HitSetType.EXPLICIT_HASH;
    }

    @Override
    public void insert(HObject object) {
        count++;
        hashes.add(object.getHash());
    }

    @Override
    public boolean contains(HObject object) {
        return hashes.contains(object.getHash());
    }

    @Override
    public long insertCount() {
        return count;
    }

    @Override
    public long approxUniqueInsertCount() {
        return hashes.size();
    }

    @Override
    public void encode(WireOutput out) {
        out.writeEnvelope(STRUCT_VERSION, STRUCT_VERSION, body -> {
            body.writeU64(count).writeU32(hashes.size());
            for (int hash : hashes) {
                body.writeU32(Integer.toUnsignedLong(hash));
            }
        });
    }

    @Override
    public void decode(WireInput in) throws MalformedInputException {
        in.readEnvelope(STRUCT_VERSION, (body, structVersion) -> {
            long decodedCount = body.readU64();
            long n = body.readU32();
            if (n * Integer.BYTES > body.remaining()) {
                throw new MalformedInputException("哈希集合长度越界 / Hash set length exceeds payload: " + n);
            }
            Set<Integer> decoded = new HashSet<>();
            for (long i = 0; i < n; i++) {
                decoded.add((int) body.readU32());
            }
            count = decodedCount;
            hashes.clear();
            hashes.addAll(decoded);
        });
    }

    @Override
    public void dump(JsonObject json) {
        json.addProperty("insert_count", count);
        JsonArray array = new JsonArray();
        hashes.stream()
                .sorted(Integer::compareUnsigned)
                .forEach(hash -> array.add(Integer.toUnsignedLong(hash)));
        json.add("hash_set", array);
    }

    @Override
    public HitTracker copy() {
        return new ExplicitHashHitTracker(this);
    }
}
