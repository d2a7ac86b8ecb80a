package io.github.vevoly.hitset.core.params;

import com.google.gson.JsonObject;
import io.github.vevoly.hitset.api.HitTracker;
import io.github.vevoly.hitset.api.codec.WireInput;
import io.github.vevoly.hitset.api.codec.WireOutput;
import io.github.vevoly.hitset.api.constants.HitSetType;
import lombok.EqualsAndHashCode;

/**
 * 不跟踪 (No Tracking). 无载荷，不创建策略.
 * <br>
 * <span style="color: gray;">No tracking: no payload, no tracker.</span>
 */
@EqualsAndHashCode(callSuper = false)
public class NoneParams extends HitSetParams {

    @Override
    public HitSetType getType() {
        return HitSetType.NONE;
    }

    @Override
    public HitSetParams copy() {
        return new NoneParams();
    }

    @Override
    public HitTracker newTracker() {
        return null;
    }

    @Override
    protected void encodePayload(WireOutput out) {
    }

    @Override
    protected void decodePayload(WireInput in) {
    }

    @Override
    protected void dumpParams(JsonObject json) {
    }
}
