package io.github.vevoly.hitset.core.params;

import com.google.gson.JsonObject;
import io.github.vevoly.hitset.api.HitTracker;
import io.github.vevoly.hitset.api.codec.WireInput;
import io.github.vevoly.hitset.api.codec.WireOutput;
import io.github.vevoly.hitset.api.constants.HitSetType;
import io.github.vevoly.hitset.api.exception.MalformedInputException;
import io.github.vevoly.hitset.core.tracker.ExplicitHashHitTracker;
import lombok.EqualsAndHashCode;

/**
 * 显式哈希集合配置，无可调参数；载荷是一个空的 v1 信封.
 * <br>
 * <span style="color: gray;">Explicit hash set configuration. Nothing to tune; the payload is an empty v1 envelope.</span>
 */
@EqualsAndHashCode(callSuper = false)
public class ExplicitHashParams extends HitSetParams {

    private static final int STRUCT_VERSION = 1;

    @Override
    public HitSetType getType() {
        return HitSetType.EXPLICIT_HASH;
    }

    @Override
    public HitSetParams copy() {
        return new ExplicitHashParams();
    }

    @Override
    public HitTracker newTracker() {
        return new ExplicitHashHitTracker();
    }

    @Override
    protected void encodePayload(WireOutput out) {
        out.writeEnvelope(STRUCT_VERSION, STRUCT_VERSION, body -> {
        });
    }

    @Override
    protected void decodePayload(WireInput in) throws MalformedInputException {
        in.readEnvelope(STRUCT_VERSION, (body, structVersion) -> {
        });
    }

    @Override
    protected void dumpParams(JsonObject json) {
    }
}
