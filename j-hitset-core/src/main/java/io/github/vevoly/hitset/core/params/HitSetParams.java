package io.github.vevoly.hitset.core.params;

import com.google.common.base.Preconditions;
import com.google.gson.JsonObject;
import io.github.vevoly.hitset.api.HitTracker;
import io.github.vevoly.hitset.api.codec.WireInput;
import io.github.vevoly.hitset.api.codec.WireOutput;
import io.github.vevoly.hitset.api.constants.HitSetType;
import io.github.vevoly.hitset.api.exception.MalformedInputException;

import java.util.Optional;

/**
 * <h3>命中集配置 (Hit Set Parameters)</h3>
 *
 * <p>
 * 描述"使用哪种跟踪策略以及如何配置它"。四种封闭的变体与 {@link HitSetType} 一一对应：
 * {@link NoneParams}、{@link ExplicitHashParams}、{@link ExplicitObjectParams}、{@link BloomParams}。
 * 配置是普通的值对象，支持深拷贝、值相等、编解码与结构化输出。
 * </p>
 * <p>
 * <b>线路格式 (Wire Format):</b> 信封 v1 {@code [u8 类型标签][变体载荷]}，NONE 无载荷。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Hit Set Parameters.</b><br>
 * Which tracking strategy to use and how to configure it. Four closed variants, one per {@link HitSetType}.
 * Parameters are plain values: deep-copyable, value-equal, encodable and dumpable.<br>
 * <b>Wire format:</b> envelope v1 {@code [u8 tag][variant payload]}; NONE carries no payload.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public abstract class HitSetParams {

    private static final int STRUCT_VERSION = 1;

    /**
     * 配置对应的类型标签 / Type tag of this variant
     */
    public abstract HitSetType getType();

    /**
     * 深拷贝 / Deep copy of the same variant
     */
    public abstract HitSetParams copy();

    /**
     * 按配置创建新的跟踪策略；NONE 不持有策略，返回 null.
     * <br>
     * <span style="color: gray;">Builds a fresh tracker for this configuration; NONE owns none and returns null.</span>
     */
    public abstract HitTracker newTracker();

    protected abstract void encodePayload(WireOutput out);

    protected abstract void decodePayload(WireInput in) throws MalformedInputException;

    protected abstract void dumpParams(JsonObject json);

    /**
     * 构建指定类型的默认配置 (Default Parameters for a Type).
     *
     * @param type 类型标签 (Type tag)
     * @return 该类型的默认配置 (Default variant for the type)
     */
    public static HitSetParams forType(HitSetType type) {
        Preconditions.checkNotNull(type, "type");
        switch (type) {
            case NONE:
                return new NoneParams();
            case EXPLICIT_HASH:
                return new ExplicitHashParams();
            case EXPLICIT_OBJECT:
                return new ExplicitObjectParams();
            case BLOOM:
                return new BloomParams();
            default:
                throw new IllegalArgumentException("未知的命中集类型 / Unknown hit set type: " + type);
        }
    }

    /**
     * 按实际类型深拷贝 / Deep copy dispatched on the live variant
     */
    public static HitSetParams createCopy(HitSetParams other) {
        Preconditions.checkNotNull(other, "params");
        return other.copy();
    }

    /**
     * <h3>类型安全的向下转型 (Typed Downcast)</h3>
     * <p>
     * 仅当实际类型标签与 {@code variant} 对应的标签一致时返回该配置，否则返回空。
     * </p>
     *
     * <span style="color: gray; font-size: 0.9em;">
     * Present iff the live tag equals the tag of {@code variant}; never an unchecked cast.
     * </span>
     */
    public <T extends HitSetParams> Optional<T> getAsType(Class<T> variant) {
        return typeOf(variant)
                .filter(type -> type == getType())
                .map(type -> variant.cast(this));
    }

    private static Optional<HitSetType> typeOf(Class<? extends HitSetParams> variant) {
        if (variant == NoneParams.class) {
            return Optional.of(HitSetType.NONE);
        }
        if (variant == ExplicitHashParams.class) {
            return Optional.of(HitSetType.EXPLICIT_HASH);
        }
        if (variant == ExplicitObjectParams.class) {
            return Optional.of(HitSetType.EXPLICIT_OBJECT);
        }
        if (variant == BloomParams.class) {
            return Optional.of(HitSetType.BLOOM);
        }
        return Optional.empty();
    }

    public final void encode(WireOutput out) {
        out.writeEnvelope(STRUCT_VERSION, STRUCT_VERSION, body -> {
            body.writeU8(getType().getCode());
            encodePayload(body);
        });
    }

    /**
     * 解码配置 (Decode Parameters).
     *
     * @throws MalformedInputException 未知类型标签或载荷非法 (Unknown tag or bad payload)
     */
    public static HitSetParams decode(WireInput in) throws MalformedInputException {
        return in.decodeEnvelope(STRUCT_VERSION, (body, structVersion) -> {
            int code = body.readU8();
            HitSetType type = HitSetType.fromCode(code)
                    .orElseThrow(() -> new MalformedInputException("未知的配置类型标签 / Unknown params type tag: " + code));
            HitSetParams params = forType(type);
            params.decodePayload(body);
            return params;
        });
    }

    public void dump(JsonObject json) {
        json.addProperty("type", getType().getTypeName());
        JsonObject impl = new JsonObject();
        dumpParams(impl);
        json.add("impl_params", impl);
    }

    @Override
    public String toString() {
        JsonObject impl = new JsonObject();
        dumpParams(impl);
        return "params type:" + getType().getTypeName() + " impl params " + impl;
    }

    /**
     * <h3>配置解码器 (Parameters Decoder)</h3>
     *
     * <p>
     * 单一所有权的配置槽位：在尚不知道配置类型的上下文中运输一个 {@link HitSetParams}。
     * {@link #extract()} 取走配置并使槽位变空；{@link #reset(HitSetParams)} 替换配置。
     * 线路格式与 {@link HitSetParams} 完全相同。
     * </p>
     *
     * <hr>
     *
     * <span style="color: gray; font-size: 0.9em;">
     * <b>Parameters Decoder.</b><br>
     * Single-owner slot carrying a {@link HitSetParams} through code that does not know its type yet.
     * {@link #extract()} takes the value and leaves the slot empty. Same wire form as {@link HitSetParams}.
     * </span>
     */
    public static class Decoder {

        private HitSetParams params;

        public Decoder() {
        }

        public Decoder(HitSetParams params) {
            this.params = params;
        }

        /**
         * 当前类型，空槽位为 NONE / Current type, NONE when empty
         */
        public HitSetType getType() {
            return params == null ? HitSetType.NONE : params.getType();
        }

        public Optional<HitSetParams> getParams() {
            return Optional.ofNullable(params);
        }

        /**
         * 取走配置，槽位变空；空槽位返回 null.
         * <br>
         * <span style="color: gray;">Takes the owned value and leaves the slot empty; null when nothing is owned.</span>
         */
        public HitSetParams extract() {
            HitSetParams taken = params;
            params = null;
            return taken;
        }

        /**
         * 替换配置，旧配置被释放 / Replaces (and releases) the owned value
         */
        public void reset(HitSetParams params) {
            this.params = params;
        }

        public void encode(WireOutput out) {
            (params == null ? new NoneParams() : params).encode(out);
        }

        /**
         * 解码到槽位。先清空，失败时保持为空.
         * <br>
         * <span style="color: gray;">Empties the slot first; stays empty when decoding fails.</span>
         */
        public void decode(WireInput in) throws MalformedInputException {
            params = null;
            params = HitSetParams.decode(in);
        }

        public void dump(JsonObject json) {
            (params == null ? new NoneParams() : params).dump(json);
        }
    }
}
