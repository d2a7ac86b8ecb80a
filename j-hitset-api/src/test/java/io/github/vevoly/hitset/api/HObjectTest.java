package io.github.vevoly.hitset.api;

import com.google.gson.JsonObject;
import io.github.vevoly.hitset.api.codec.WireInput;
import io.github.vevoly.hitset.api.codec.WireOutput;
import io.github.vevoly.hitset.api.exception.MalformedInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("HObject Tests")
class HObjectTest {

    @Test
    @DisplayName("Should survive an encode/decode cycle with unsigned fields intact")
    void testDecode_EncodedObject_ReturnsEqualObject() throws MalformedInputException {
        // Given
        HObject object = new HObject(-3L, "ns", "locator", "obj-1", 0xFFFF_FFFF_0000_0001L, 0x8000_0001);
        WireOutput out = new WireOutput();
        object.encode(out);

        // When
        HObject decoded = HObject.decode(new WireInput(out.toByteArray()));

        // Then
        assertEquals(object, decoded);
        assertEquals(object.hashCode(), decoded.hashCode());
    }

    @Test
    @DisplayName("Should order by pool, then unsigned hash, then names")
    void testCompareTo_Ordering() {
        // Given
        HObject lowHash = new HObject(1L, "", "", "b", HObject.NOSNAP, 1);
        HObject highHash = new HObject(1L, "", "", "a", HObject.NOSNAP, -1);
        HObject otherPool = new HObject(0L, "", "", "z", HObject.NOSNAP, -1);
        List<HObject> objects = new ArrayList<>(Arrays.asList(highHash, lowHash, otherPool));

        // When
        Collections.sort(objects);

        // Then
        assertEquals(Arrays.asList(otherPool, lowHash, highHash), objects);
    }

    @Test
    @DisplayName("Should dump head snapshot and unsigned hash")
    void testDump_HeadObject() {
        // Given
        HObject object = HObject.of("obj", -1);
        JsonObject json = new JsonObject();

        // When
        object.dump(json);

        // Then
        assertEquals("obj", json.get("oid").getAsString());
        assertEquals("head", json.get("snap").getAsString());
        assertEquals(0xFFFFFFFFL, json.get("hash").getAsLong());
        assertEquals(0L, json.get("pool").getAsLong());
    }

    @Test
    @DisplayName("Should reject null names")
    void testConstructor_NullOid_Throws() {
        assertThrows(NullPointerException.class, () -> new HObject(0L, "", "", null, HObject.NOSNAP, 0));
    }
}
