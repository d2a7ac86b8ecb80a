package io.github.vevoly.hitset.core.bloom;

import com.google.gson.JsonObject;
import io.github.vevoly.hitset.api.codec.WireInput;
import io.github.vevoly.hitset.api.codec.WireOutput;
import io.github.vevoly.hitset.api.exception.MalformedInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CompressibleBloomFilter Tests")
class CompressibleBloomFilterTest {

    @Test
    @DisplayName("Should pick the hash count minimising the table size")
    void testConstructor_Sizing() {
        // Given / When
        CompressibleBloomFilter filter = new CompressibleBloomFilter(1000, 0.01, 1);

        // Then
        assertEquals(7, filter.getSaltCount());
        assertTrue(filter.getTableSize() * 8L >= 9592, "table bits: " + filter.getTableSize() * 8L);
        assertTrue(filter.getTableSize() <= 1201, "table bytes: " + filter.getTableSize());
        assertEquals(1, filter.getSizeList().size());
    }

    @Test
    @DisplayName("Should replace a zero seed with the default seed")
    void testConstructor_ZeroSeed_UsesDefault() {
        CompressibleBloomFilter filter = new CompressibleBloomFilter(10, 0.1, 0);

        assertEquals(0xA5A5A5A5L, filter.getSeed());
    }

    @Test
    @DisplayName("Should reject rates outside (0, 1) and empty targets")
    void testConstructor_InvalidArguments_Throw() {
        assertThrows(IllegalArgumentException.class, () -> new CompressibleBloomFilter(10, 0.0, 1));
        assertThrows(IllegalArgumentException.class, () -> new CompressibleBloomFilter(10, 1.0, 1));
        assertThrows(IllegalArgumentException.class, () -> new CompressibleBloomFilter(0, 0.1, 1));
    }

    @Test
    @DisplayName("Should never report an inserted value absent")
    void testContains_InsertedValues_NoFalseNegatives() {
        // Given
        CompressibleBloomFilter filter = new CompressibleBloomFilter(500, 0.01, 7);

        // When
        for (int i = 0; i < 500; i++) {
            filter.insert(i * 0x9E3779B9);
        }

        // Then
        for (int i = 0; i < 500; i++) {
            assertTrue(filter.contains(i * 0x9E3779B9));
        }
        assertEquals(500, filter.elementCount());
        assertTrue(filter.approxUniqueElementCount() <= filter.elementCount());
    }

    @Test
    @DisplayName("Should estimate unique values from density")
    void testApproxUniqueElementCount_CloseToDistinctCount() {
        // Given
        CompressibleBloomFilter filter = new CompressibleBloomFilter(1000, 0.01, 3);

        // When
        for (int i = 0; i < 200; i++) {
            filter.insert(i);
            filter.insert(i);
        }

        // Then
        assertEquals(400, filter.elementCount());
        long estimate = filter.approxUniqueElementCount();
        assertTrue(estimate >= 180 && estimate <= 220, "estimate: " + estimate);
    }

    @Test
    @DisplayName("Should keep inserted values after compression")
    void testCompress_KeepsMembership() {
        // Given
        CompressibleBloomFilter filter = new CompressibleBloomFilter(1000, 0.01, 11);
        for (int i = 0; i < 100; i++) {
            filter.insert(i);
        }
        int before = filter.getTableSize();

        // When
        boolean compressed = filter.compress(25);

        // Then
        assertTrue(compressed);
        assertEquals(before * 25 / 100, filter.getTableSize());
        assertEquals(Arrays.asList((long) before, (long) filter.getTableSize()), filter.getSizeList());
        for (int i = 0; i < 100; i++) {
            assertTrue(filter.contains(i), "lost value " + i);
        }
    }

    @Test
    @DisplayName("Should refuse compression targets that do not shrink the table")
    void testCompress_InvalidPercent_Rejected() {
        // Given
        CompressibleBloomFilter filter = new CompressibleBloomFilter(100, 0.1, 1);
        int size = filter.getTableSize();

        // When / Then
        assertFalse(filter.compress(0));
        assertFalse(filter.compress(100));
        assertFalse(filter.compress(150));
        assertFalse(filter.compress(0.0001));
        assertEquals(size, filter.getTableSize());
    }

    @Test
    @DisplayName("Should treat an unsized filter as empty and refuse inserts")
    void testUnsizedFilter() {
        CompressibleBloomFilter filter = new CompressibleBloomFilter();

        assertFalse(filter.contains(1));
        assertEquals(0, filter.approxUniqueElementCount());
        assertThrows(IllegalStateException.class, () -> filter.insert(1));
    }

    @Test
    @DisplayName("Should restore a compressed filter from its wire form")
    void testDecode_CompressedFilter_RoundTrip() throws MalformedInputException {
        // Given
        CompressibleBloomFilter filter = new CompressibleBloomFilter(1000, 0.05, 5);
        for (int i = 0; i < 40; i++) {
            filter.insert(i * 31);
        }
        filter.compress(10);
        WireOutput out = new WireOutput();
        filter.encode(out);

        // When
        CompressibleBloomFilter decoded = new CompressibleBloomFilter();
        decoded.decode(new WireInput(out.toByteArray()));

        // Then
        assertEquals(filter.getSaltCount(), decoded.getSaltCount());
        assertEquals(filter.getSizeList(), decoded.getSizeList());
        assertEquals(filter.elementCount(), decoded.elementCount());
        assertEquals(filter.approxUniqueElementCount(), decoded.approxUniqueElementCount());
        for (int i = 0; i < 40; i++) {
            assertTrue(decoded.contains(i * 31));
        }
    }

    @Test
    @DisplayName("Should write envelope version 2 with compat 2")
    void testEncode_EnvelopeVersion() {
        WireOutput out = new WireOutput();
        new CompressibleBloomFilter(10, 0.1, 1).encode(out);

        byte[] bytes = out.toByteArray();
        assertEquals(2, bytes[0]);
        assertEquals(2, bytes[1]);
    }

    @Test
    @DisplayName("Should reject a size list that does not match the table")
    void testDecode_InconsistentSizes_ThrowsMalformed() {
        // Given
        WireOutput out = new WireOutput().writeEnvelope(2, 2, body -> body
                .writeU64(3)
                .writeU64(0)
                .writeU64(10)
                .writeU64(1)
                .writeBytes(new byte[8])
                .writeU32(1)
                .writeU64(16));

        // When / Then
        assertThrows(MalformedInputException.class,
                () -> new CompressibleBloomFilter().decode(new WireInput(out.toByteArray())));
    }

    @Test
    @DisplayName("Should dump the filter fields")
    void testDump_Fields() {
        JsonObject json = new JsonObject();
        new CompressibleBloomFilter(10, 0.1, 1).dump(json);

        for (String field : Arrays.asList("salt_count", "table_size", "insert_count",
                "target_element_count", "seed", "density", "size_list")) {
            assertTrue(json.has(field), field);
        }
    }
}
