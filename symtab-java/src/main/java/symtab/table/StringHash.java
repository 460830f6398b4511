package symtab.table;

import java.nio.charset.StandardCharsets;

/** djb2 over the UTF-8 bytes of a name, 64-bit unsigned with wraparound. */
public final class StringHash {
    static final long SEED = 5381L;

    private StringHash() {}

    public static long djb2(String s) {
        long h = SEED;
        for (byte b : s.getBytes(StandardCharsets.UTF_8)) {
            h = ((h << 5) + h) + (b & 0xFF); // h * 33 + b
        }
        return h;
    }

    public static int index(String s, int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be positive: " + capacity);
        return (int) Long.remainderUnsigned(djb2(s), capacity);
    }
}
