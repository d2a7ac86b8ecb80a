package io.github.vevoly.hitset.core.params;

import com.google.gson.JsonObject;
import io.github.vevoly.hitset.api.HObject;
import io.github.vevoly.hitset.api.codec.WireInput;
import io.github.vevoly.hitset.api.codec.WireOutput;
import io.github.vevoly.hitset.api.constants.HitSetType;
import io.github.vevoly.hitset.api.exception.MalformedInputException;
import io.github.vevoly.hitset.core.HitSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("HitSetParams Tests")
class HitSetParamsTest {

    private static byte[] encode(HitSetParams params) {
        WireOutput out = new WireOutput();
        params.encode(out);
        return out.toByteArray();
    }

    @ParameterizedTest
    @EnumSource(HitSetType.class)
    @DisplayName("Should build the matching variant for every type and decode it back")
    void testForType_RoundTrip(HitSetType type) throws MalformedInputException {
        // Given
        HitSetParams params = HitSetParams.forType(type);

        // When
        HitSetParams decoded = HitSetParams.decode(new WireInput(encode(params)));

        // Then
        assertEquals(type, params.getType());
        assertEquals(params, decoded);
    }

    @Test
    @DisplayName("Should not carry a payload for none")
    void testEncode_None_OnlyTag() {
        assertArrayEquals(new byte[]{1, 1, 1, 0, 0, 0, 0}, encode(new NoneParams()));
    }

    @Test
    @DisplayName("Should encode the bloom rate as micro-units in 16 bits")
    void testEncode_Bloom_Layout() {
        // Given
        BloomParams params = new BloomParams(0.01, 10, 1);

        // When
        byte[] bytes = encode(params);

        // Then: outer header, tag, inner header, u16 rate
        assertEquals(3, bytes[6]);
        assertEquals(10000, (bytes[13] & 0xFF) | (bytes[14] & 0xFF) << 8);
        assertEquals(6 + 1 + 6 + 2 + 8 + 8, bytes.length);
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.000001, 0.001, 0.01, 0.05, 0.065535})
    @DisplayName("Should decode the false positive rate within fixed-point resolution")
    void testDecode_BloomRate_RoundTrip(double rate) throws MalformedInputException {
        // Given
        BloomParams params = new BloomParams(rate, 1000, 42);

        // When
        BloomParams decoded = HitSetParams.decode(new WireInput(encode(params)))
                .getAsType(BloomParams.class)
                .orElseThrow(AssertionError::new);

        // Then
        assertEquals(rate, decoded.getFalsePositive(), 0.5 / BloomParams.FPP_SCALE);
        assertEquals(1000, decoded.getTargetSize());
        assertEquals(42, decoded.getSeed());
    }

    @Test
    @DisplayName("Should saturate rates that do not fit in 16 bits")
    void testEncode_LargeRate_Saturates() throws MalformedInputException {
        // Given
        BloomParams params = new BloomParams(0.1, 10, 1);

        // When
        HitSetParams decoded = HitSetParams.decode(new WireInput(encode(params)));

        // Then
        assertEquals(0xFFFF, params.falsePositiveMicros());
        assertEquals(BloomParams.MAX_ENCODABLE_FALSE_POSITIVE,
                ((BloomParams) decoded).getFalsePositive(), 1e-12);
    }

    @Test
    @DisplayName("Should keep a tiny positive rate usable after decode")
    void testEncode_TinyRate_RaisedToResolution() throws MalformedInputException {
        // Given
        BloomParams params = new BloomParams(4e-7, 100, 1);

        // When
        HitSetParams decoded = HitSetParams.decode(new WireInput(encode(params)));
        HitSet hitSet = new HitSet(decoded);
        hitSet.insert(HObject.of("a", 1));

        // Then
        assertEquals(1, params.falsePositiveMicros());
        assertEquals(BloomParams.MIN_ENCODABLE_FALSE_POSITIVE, ((BloomParams) decoded).getFalsePositive(), 1e-15);
        assertTrue(hitSet.contains(HObject.of("a", 1)));
    }

    @Test
    @DisplayName("Should reject an unknown type tag")
    void testDecode_UnknownTag_ThrowsMalformed() {
        byte[] bytes = {1, 1, 1, 0, 0, 0, 9};

        assertThrows(MalformedInputException.class, () -> HitSetParams.decode(new WireInput(bytes)));
    }

    @Test
    @DisplayName("Should only downcast to the live variant")
    void testGetAsType_OnlyMatchingVariant() {
        // Given
        HitSetParams params = new BloomParams(0.1, 10, 1);

        // When / Then
        assertTrue(params.getAsType(BloomParams.class).isPresent());
        assertFalse(params.getAsType(ExplicitHashParams.class).isPresent());
        assertFalse(params.getAsType(ExplicitObjectParams.class).isPresent());
        assertFalse(params.getAsType(NoneParams.class).isPresent());
        assertFalse(params.getAsType(HitSetParams.class).isPresent());
    }

    @Test
    @DisplayName("Should copy deeply")
    void testCreateCopy_Independent() {
        // Given
        BloomParams original = new BloomParams(0.01, 100, 3);

        // When
        BloomParams copy = (BloomParams) HitSetParams.createCopy(original);
        copy.setTargetSize(999);

        // Then
        assertNotSame(original, copy);
        assertEquals(100, original.getTargetSize());
        assertNotEquals(original, copy);
    }

    @Test
    @DisplayName("Should dump type and impl params")
    void testDump_Bloom() {
        JsonObject json = new JsonObject();
        new BloomParams(0.1, 10, 1).dump(json);

        assertEquals("bloom", json.get("type").getAsString());
        JsonObject impl = json.getAsJsonObject("impl_params");
        assertEquals(0.1, impl.get("false_positive_probability").getAsDouble());
        assertEquals(10, impl.get("target_size").getAsLong());
        assertEquals(1, impl.get("seed").getAsLong());
    }

    @Test
    @DisplayName("Should render a readable summary")
    void testToString() {
        assertEquals("params type:explicit_hash impl params {}", new ExplicitHashParams().toString());
        assertTrue(new BloomParams(0.1, 10, 1).toString().startsWith("params type:bloom impl params {"));
    }
}
