package io.github.vevoly.hitset.core.tracker;

import com.google.gson.JsonObject;
import io.github.vevoly.hitset.api.HObject;
import io.github.vevoly.hitset.api.codec.WireInput;
import io.github.vevoly.hitset.api.codec.WireOutput;
import io.github.vevoly.hitset.api.exception.MalformedInputException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ExplicitObjectHitTracker Tests")
class ExplicitObjectHitTrackerTest {

    private ExplicitObjectHitTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new ExplicitObjectHitTracker();
    }

    @Test
    @DisplayName("Should distinguish objects sharing a hash")
    void testContains_SameHashDifferentObject_False() {
        // Given
        tracker.insert(HObject.of("a", 1));

        // When
        boolean found = tracker.contains(HObject.of("b", 1));

        // Then
        assertFalse(found);
        assertTrue(tracker.contains(HObject.of("a", 1)));
    }

    @Test
    @DisplayName("Should reproduce full identities after decode")
    void testDecode_RoundTrip() throws MalformedInputException {
        // Given
        HObject first = new HObject(4L, "ns", "k", "first", 12L, 0x7FFF_FFFF);
        HObject second = new HObject(4L, "", "", "second", HObject.NOSNAP, -2);
        tracker.insert(first);
        tracker.insert(second);
        tracker.insert(first);
        WireOutput out = new WireOutput();
        tracker.encode(out);

        // When
        ExplicitObjectHitTracker decoded = new ExplicitObjectHitTracker();
        decoded.decode(new WireInput(out.toByteArray()));

        // Then
        assertEquals(3, decoded.insertCount());
        assertEquals(2, decoded.approxUniqueInsertCount());
        assertTrue(decoded.contains(first));
        assertTrue(decoded.contains(second));
    }

    @Test
    @DisplayName("Should leave the tracker untouched when decoding fails")
    void testDecode_Truncated_KeepsPreviousState() {
        // Given
        tracker.insert(HObject.of("a", 1));
        WireOutput out = new WireOutput();
        tracker.encode(out);
        byte[] bytes = out.toByteArray();
        byte[] truncated = new byte[bytes.length - 3];
        System.arraycopy(bytes, 0, truncated, 0, truncated.length);
        ExplicitObjectHitTracker target = new ExplicitObjectHitTracker();
        target.insert(HObject.of("kept", 5));

        // When
        assertThrows(MalformedInputException.class, () -> target.decode(new WireInput(truncated)));

        // Then
        assertEquals(1, target.insertCount());
        assertTrue(target.contains(HObject.of("kept", 5)));
    }

    @Test
    @DisplayName("Should dump every object")
    void testDump() {
        tracker.insert(HObject.of("a", 1));
        tracker.insert(HObject.of("b", 2));
        JsonObject json = new JsonObject();

        tracker.dump(json);

        assertEquals(2, json.get("insert_count").getAsLong());
        assertEquals(2, json.getAsJsonArray("set").size());
        assertEquals("a", json.getAsJsonArray("set").get(0).getAsJsonObject().get("oid").getAsString());
    }
}
