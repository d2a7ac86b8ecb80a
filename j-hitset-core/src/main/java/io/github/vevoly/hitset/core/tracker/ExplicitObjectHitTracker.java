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
 * <h3>显式对象集合策略 (Explicit Object Strategy)</h3>
 *
 * <p>
 * 记录完整的对象标识，100% 准确，无误判。内存占用最高。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Explicit Object Strategy.</b><br>
 * Stores full object identities. Exact, no false positives, highest memory usage.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class ExplicitObjectHitTracker implements HitTracker {

    private static final int STRUCT_VERSION = 1;

    // HObject 最小编码长度：信封头 6 字节 + 3 个空字符串 + snap/hash/pool
    private static final int MIN_OBJECT_BYTES = 6 + 3 * Integer.BYTES + Long.BYTES + Integer.BYTES + Long.BYTES;

    private long count;
    private final Set<HObject> objects;

    public ExplicitObjectHitTracker() {
        this.objects = new HashSet<>();
    }

    private ExplicitObjectHitTracker(ExplicitObjectHitTracker other) {
        this.count = other.count;
        // HObject 不可变，浅复制元素即可 / HObject is immutable
        this.objects = new HashSet<>(other.objects);
    }

    @Override
    public HitSetType getType() {
        return HitSetType.EXPLICIT_OBJECT;
    }

    @Override
    public void insert(HObject object) {
        count++;
        objects.add(object);
    }

    @Override
    public boolean contains(HObject object) {
        return objects.contains(object);
    }

    @Override
    public long insertCount() {
        return count;
    }

    @Override
    public long approxUniqueInsertCount() {
        return objects.size();
    }

    @Override
    public void encode(WireOutput out) {
        out.writeEnvelope(STRUCT_VERSION, STRUCT_VERSION, body -> {
            body.writeU64(count).writeU32(objects.size());
            for (HObject object : objects) {
                object.encode(body);
            }
        });
    }

    @Override
    public void decode(WireInput in) throws MalformedInputException {
        in.readEnvelope(STRUCT_VERSION, (body, structVersion) -> {
            long decodedCount = body.readU64();
            long n = body.readU32();
            if (n * MIN_OBJECT_BYTES > body.remaining()) {
                throw new MalformedInputException("对象集合长度越界 / Object set length exceeds payload: " + n);
            }
            Set<HObject> decoded = new HashSet<>();
            for (long i = 0; i < n; i++) {
                decoded.add(HObject.decode(body));
            }
            count = decodedCount;
            objects.clear();
            objects.addAll(decoded);
        });
    }

    @Override
    public void dump(JsonObject json) {
        json.addProperty("insert_count", count);
        JsonArray array = new JsonArray();
        objects.stream().sorted().forEach(object -> {
            JsonObject entry = new JsonObject();
            object.dump(entry);
            array.add(entry);
        });
        json.add("set", array);
    }

    @Override
    public HitTracker copy() {
        return new ExplicitObjectHitTracker(this);
    }
}
