package symtab.table;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class StringHashTest {

    @Test
    void djb2_empty_string_is_seed() {
        assertEquals(5381L, StringHash.djb2(""));
    }

    @ParameterizedTest
    @CsvSource({
            "a, 177670",
            "sum, 193506202",
            "count, 210709076078",
            "variable1, 249910439228072188"
    })
    void djb2_known_values(String name, long expected) {
        assertEquals(expected, StringHash.djb2(name));
    }

    @Test
    void djb2_wraps_around_64_bits() {
        long h = StringHash.djb2("abcdefghijklmnopqrstuvwxyz");
        assertEquals(Long.parseUnsignedLong("18111394293885285892"), h);
        assertTrue(h < 0); // top bit set, must be reduced as unsigned
        assertEquals(2, StringHash.index("abcdefghijklmnopqrstuvwxyz", 10));
        assertEquals(12, StringHash.index("abcdefghijklmnopqrstuvwxyz", 20));
    }

    @Test
    void djb2_uses_unsigned_utf8_bytes() {
        // é = 0xC3 0xA9
        assertEquals(5866513L, StringHash.djb2("é"));
        assertEquals(3, StringHash.index("é", 10));
    }

    @ParameterizedTest
    @CsvSource({
            "variable1, 8, 8",
            "count, 8, 18",
            "sum, 2, 2",
            "array, 6, 16",
            "index, 1, 1",
            "max, 9, 19",
            "temp, 1, 11"
    })
    void index_at_capacity_10_and_20(String name, int at10, int at20) {
        assertEquals(at10, StringHash.index(name, 10));
        assertEquals(at20, StringHash.index(name, 20));
    }

    @Test
    void index_rejects_non_positive_capacity() {
        assertThrows(IllegalArgumentException.class, () -> StringHash.index("x", 0));
    }
}
