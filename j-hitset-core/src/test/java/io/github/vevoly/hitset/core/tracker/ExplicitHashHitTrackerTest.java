package io.github.vevoly.hitset.core.tracker;

import com.google.gson.JsonObject;
import io.github.vevoly.hitset.api.HObject;
import io.github.vevoly.hitset.api.HitTracker;
import io.github.vevoly.hitset.api.codec.WireInput;
import io.github.vevoly.hitset.api.codec.WireOutput;
import io.github.vevoly.hitset.api.constants.HitSetType;
import io.github.vevoly.hitset.api.exception.MalformedInputException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ExplicitHashHitTracker Tests")
class ExplicitHashHitTrackerTest {

    private ExplicitHashHitTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new ExplicitHashHitTracker();
    }

    @Test
    @DisplayName("Should count every insert and deduplicate by hash")
    void testInsert_Duplicates_CountedOnceInUnique() {
        // Given
        HObject first = HObject.of("a", 1);
        HObject sameHash = HObject.of("b", 1);
        HObject other = HObject.of("c", 2);

        // When
        tracker.insert(first);
        tracker.insert(first);
        tracker.insert(sameHash);
        tracker.insert(other);

        // Then
        assertEquals(HitSetType.EXPLICIT_HASH, tracker.getType());
        assertEquals(4, tracker.insertCount());
        assertEquals(2, tracker.approxUniqueInsertCount());
        assertTrue(tracker.contains(HObject.of("never inserted", 2)));
        assertFalse(tracker.contains(HObject.of("d", 3)));
    }

    @Test
    @DisplayName("Should reproduce counts and members after decode")
    void testDecode_RoundTrip() throws MalformedInputException {
        // Given
        tracker.insert(HObject.of("a", -7));
        tracker.insert(HObject.of("b", 9));
        tracker.insert(HObject.of("b", 9));
        WireOutput out = new WireOutput();
        tracker.encode(out);

        // When
        ExplicitHashHitTracker decoded = new ExplicitHashHitTracker();
        decoded.decode(new WireInput(out.toByteArray()));

        // Then
        assertEquals(3, decoded.insertCount());
        assertEquals(2, decoded.approxUniqueInsertCount());
        assertTrue(decoded.contains(HObject.of("x", -7)));
        assertTrue(decoded.contains(HObject.of("y", 9)));
    }

    @Test
    @DisplayName("Should reject a set length larger than the payload")
    void testDecode_TruncatedSet_ThrowsMalformed() {
        // Given
        WireOutput out = new WireOutput().writeEnvelope(1, 1, body -> body.writeU64(5).writeU32(1000).writeU32(1));

        // When / Then
        assertThrows(MalformedInputException.class, () -> tracker.decode(new WireInput(out.toByteArray())));
    }

    @Test
    @DisplayName("Should copy without sharing state")
    void testCopy_Independent() {
        // Given
        tracker.insert(HObject.of("a", 1));

        // When
        HitTracker copy = tracker.copy();
        copy.insert(HObject.of("b", 2));

        // Then
        assertEquals(1, tracker.insertCount());
        assertFalse(tracker.contains(HObject.of("b", 2)));
        assertEquals(2, copy.insertCount());
    }

    @Test
    @DisplayName("Should dump insert count and hashes")
    void testDump() {
        tracker.insert(HObject.of("a", -1));
        JsonObject json = new JsonObject();

        tracker.dump(json);

        assertEquals(1, json.get("insert_count").getAsLong());
        assertEquals(0xFFFFFFFFL, json.getAsJsonArray("hash_set").get(0).getAsLong());
    }
}
