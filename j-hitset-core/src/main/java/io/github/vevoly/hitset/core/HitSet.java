package io.github.vevoly.hitset.core;

import com.google.common.base.Preconditions;
import com.google.gson.JsonObject;
import io.github.vevoly.hitset.api.HObject;
import io.github.vevoly.hitset.api.HitTracker;
import io.github.vevoly.hitset.api.codec.WireInput;
import io.github.vevoly.hitset.api.codec.WireOutput;
import io.github.vevoly.hitset.api.constants.HitSetType;
import io.github.vevoly.hitset.api.exception.MalformedInputException;
import io.github.vevoly.hitset.core.params.HitSetParams;
import io.github.vevoly.hitset.core.tracker.BloomHitTracker;
import io.github.vevoly.hitset.core.tracker.ExplicitHashHitTracker;
import io.github.vevoly.hitset.core.tracker.ExplicitObjectHitTracker;
import lombok.extern.slf4j.Slf4j;

/**
 * <h3>命中集 (Hit Set)</h3>
 *
 * <p>
 * 一个分片在一个跟踪周期内的访问记录。容器至多持有一个 {@link HitTracker}；不持有时类型为 {@code none}，
 * 此时 {@link #insert(HObject)} / {@link #contains(HObject)} 以及计数方法均属于调用方错误。
 * </p>
 * <ul>
 *     <li><b>线路格式:</b> 信封 v1 {@code [u8 类型标签][策略载荷]}，{@code none} 无载荷。</li>
 *     <li><b>解码失败:</b> 容器被重置为 {@code none} 后再抛出 {@link MalformedInputException}，不会残留半解码状态。</li>
 *     <li><b>复制:</b> {@link #copyOf(HitSet)} 按策略类型深拷贝，不共享内部状态。</li>
 *     <li><b>线程安全:</b> 非线程安全，调用方负责互斥。</li>
 * </ul>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Hit Set.</b><br>
 * The record of which objects one shard saw during one tracking interval. Owns at most one {@link HitTracker};
 * without one the type is {@code none} and insert, contains and the counters are caller errors.<br>
 * <b>Wire:</b> envelope v1 {@code [u8 tag][tracker payload]}.<br>
 * <b>Decode failures</b> reset the container to {@code none} before the exception surfaces.<br>
 * <b>Copy:</b> {@link #copyOf(HitSet)} is a deep copy. Not thread-safe.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Slf4j
public class HitSet {

    private static final int STRUCT_VERSION = 1;

    /**
     * 当前策略，null 表示 none / Current tracker, null means none
     */
    private HitTracker tracker;

    /**
     * 空命中集 (类型 none) / Empty hit set of type none
     */
    public HitSet() {
    }

    /**
     * 按类型创建 (Create by Type).
     * <p>
     * BLOOM 类型得到未分配位表的过滤器，只适合作为解码目标；需要可插入的布隆命中集请使用 {@link #HitSet(HitSetParams)}。
     * </p>
     * <span style="color: gray;">BLOOM yields an unsized filter, only usable as a decode target.</span>
     *
     * @param type 类型标签 (Type tag)
     */
    public HitSet(HitSetType type) {
        this.tracker = newTracker(type);
    }

    /**
     * 按配置创建 (Create from Parameters).
     *
     * @param params 配置 (Parameters)
     */
    public HitSet(HitSetParams params) {
        Preconditions.checkNotNull(params, "params");
        this.tracker = params.newTracker();
    }

    private HitSet(HitTracker tracker) {
        this.tracker = tracker;
    }

    /**
     * 按类型编号创建 (Create by Type Code).
     *
     * @throws IllegalArgumentException 未知编号 (Unknown code)
     */
    public static HitSet forTypeCode(int code) {
        HitSetType type = HitSetType.fromCode(code)
                .orElseThrow(() -> new IllegalArgumentException("未知的命中集类型编号 / Unknown hit set type code: " + code));
        return new HitSet(type);
    }

    /**
     * 深拷贝 / Deep copy
     */
    public static HitSet copyOf(HitSet other) {
        Preconditions.checkNotNull(other, "hit set");
        return new HitSet(other.tracker == null ? null : other.tracker.copy());
    }

    private static HitTracker newTracker(HitSetType type) {
        Preconditions.checkNotNull(type, "type");
        switch (type) {
            case NONE:
                return null;
            case EXPLICIT_HASH:
                return new ExplicitHashHitTracker();
            case EXPLICIT_OBJECT:
                return new ExplicitObjectHitTracker();
            case BLOOM:
                return new BloomHitTracker();
            default:
                throw new IllegalArgumentException("未知的命中集类型 / Unknown hit set type: " + type);
        }
    }

    public HitSetType getType() {
        return tracker == null ? HitSetType.NONE : tracker.getType();
    }

    public String getTypeName() {
        return getType().getTypeName();
    }

    /**
     * 是否持有跟踪策略 / Whether a tracker is owned
     */
    public boolean isTracking() {
        return tracker != null;
    }

    public void insert(HObject object) {
        requireTracker().insert(object);
    }

    public boolean contains(HObject object) {
        return requireTracker().contains(object);
    }

    public long insertCount() {
        return requireTracker().insertCount();
    }

    public long approxUniqueInsertCount() {
        return requireTracker().approxUniqueInsertCount();
    }

    /**
     * 周期结束后压缩内部结构；none 时不做任何事.
     * <br>
     * <span style="color: gray;">Shrinks the tracker at the end of an interval; no-op for none.</span>
     */
    public void optimize() {
        if (tracker != null) {
            tracker.optimize();
        }
    }

    private HitTracker requireTracker() {
        Preconditions.checkState(tracker != null, "命中集未持有跟踪策略 / Hit set of type none has no tracker");
        return tracker;
    }

    public void encode(WireOutput out) {
        out.writeEnvelope(STRUCT_VERSION, STRUCT_VERSION, body -> {
            body.writeU8(getType().getCode());
            if (tracker != null) {
                tracker.encode(body);
            }
        });
    }

    public byte[] toBytes() {
        WireOutput out = new WireOutput();
        encode(out);
        return out.toByteArray();
    }

    /**
     * <h3>解码 (Decode)</h3>
     * <p>
     * 先重置为 none；只有在载荷完整解码后才持有新策略。
     * </p>
     *
     * <span style="color: gray; font-size: 0.9em;">
     * Resets to none first; the new tracker is only installed once its payload decoded completely.
     * </span>
     *
     * @throws MalformedInputException 未知类型标签或载荷非法 (Unknown tag or bad payload)
     */
    public void decode(WireInput in) throws MalformedInputException {
        tracker = null;
        HitTracker decoded = in.decodeEnvelope(STRUCT_VERSION, (body, structVersion) -> {
            int code = body.readU8();
            HitSetType type = HitSetType.fromCode(code)
                    .orElseThrow(() -> new MalformedInputException("未知的命中集类型标签 / Unknown hit set type tag: " + code));
            HitTracker target = newTracker(type);
            if (target != null) {
                target.decode(body);
            }
            return target;
        });
        log.debug("命中集解码完成 / Hit set decoded: type={}", decoded == null ? HitSetType.NONE : decoded.getType());
        tracker = decoded;
    }

    public static HitSet fromBytes(byte[] bytes) throws MalformedInputException {
        HitSet hitSet = new HitSet();
        hitSet.decode(new WireInput(bytes));
        return hitSet;
    }

    public void dump(JsonObject json) {
        json.addProperty("type", getTypeName());
        if (tracker != null) {
            tracker.dump(json);
        }
    }

    @Override
    public String toString() {
        JsonObject json = new JsonObject();
        dump(json);
        return json.toString();
    }
}
