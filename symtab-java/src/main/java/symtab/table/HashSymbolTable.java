package symtab.table;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Separate-chaining hash table keyed by {@link StringHash#djb2}.
 * New entries go to the head of their chain. Capacity doubles before an insert
 * that would push the load factor over the threshold.
 */
public final class HashSymbolTable implements SymbolTable {
    public static final int DEFAULT_CAPACITY = 10;
    public static final double DEFAULT_LOAD_FACTOR = 0.75;

    private static final class Entry {
        final String name;
        final int position;
        Entry next;

        Entry(String name, int position, Entry next) {
            this.name = name;
            this.position = position;
            this.next = next;
        }
    }

    private final double loadFactorThreshold;
    private Entry[] buckets;
    private int size;
    private int nextPosition;
    private ResizeListener resizeListener = (oldCapacity, newCapacity) -> {};

    public HashSymbolTable() { this(DEFAULT_CAPACITY, DEFAULT_LOAD_FACTOR); }

    public HashSymbolTable(int initialCapacity, double loadFactorThreshold) {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("Initial capacity must be positive: " + initialCapacity);
        }
        if (!(loadFactorThreshold > 0) || Double.isInfinite(loadFactorThreshold)) {
            throw new IllegalArgumentException("Load factor threshold must be a positive number: " + loadFactorThreshold);
        }
        this.buckets = new Entry[initialCapacity];
        this.loadFactorThreshold = loadFactorThreshold;
    }

    public void setResizeListener(ResizeListener listener) {
        this.resizeListener = listener != null ? listener : (oldCapacity, newCapacity) -> {};
    }

    @Override
    public int add(String name) {
        int existing = search(name);
        if (existing != NOT_FOUND) return existing;

        if ((double) (size + 1) / buckets.length > loadFactorThreshold) {
            resize();
        }

        int index = StringHash.index(name, buckets.length);
        int position = nextPosition++;
        buckets[index] = new Entry(name, position, buckets[index]);
        size++;
        return position;
    }

    @Override
    public int search(String name) {
        checkName(name);
        for (Entry e = buckets[StringHash.index(name, buckets.length)]; e != null; e = e.next) {
            if (e.name.equals(name)) return e.position;
        }
        return NOT_FOUND;
    }

    private void resize() {
        Entry[] old = buckets;
        int expected = size;
        buckets = new Entry[old.length * 2];
        size = 0;

        // move, don't copy: entries keep their identity and position
        for (Entry head : old) {
            Entry e = head;
            while (e != null) {
                Entry next = e.next;
                int index = StringHash.index(e.name, buckets.length);
                e.next = buckets[index];
                buckets[index] = e;
                size++;
                e = next;
            }
        }

        if (size != expected) {
            throw new IllegalStateException("Rehash lost entries: expected " + expected + ", got " + size);
        }
        resizeListener.resized(old.length, buckets.length);
    }

    @Override
    public int size() {
        checkAlive();
        return size;
    }

    public int capacity() {
        checkAlive();
        return buckets.length;
    }

    public double loadFactor() {
        checkAlive();
        return (double) size / buckets.length;
    }

    /** Bucket the name hashes to at the current capacity, whether or not it is stored. */
    public int bucketOf(String name) {
        checkName(name);
        return StringHash.index(name, buckets.length);
    }

    @Override
    public List<Symbol> symbols() {
        checkAlive();
        List<Symbol> out = new ArrayList<>(size);
        for (Entry head : buckets) {
            for (Entry e = head; e != null; e = e.next) {
                out.add(new Symbol(e.name, e.position));
            }
        }
        return Collections.unmodifiableList(out);
    }

    /** Chain of one bucket, head first. */
    public List<Symbol> chain(int bucket) {
        checkAlive();
        List<Symbol> out = new ArrayList<>();
        for (Entry e = buckets[bucket]; e != null; e = e.next) {
            out.add(new Symbol(e.name, e.position));
        }
        return Collections.unmodifiableList(out);
    }

    @Override
    public void display(PrintStream out) {
        checkAlive();
        out.println();
        out.println("=== SYMBOL TABLE (HASH TABLE) ===");
        out.printf(Locale.ROOT, "Size: %d, Capacity: %d, Load Factor: %.2f%n", size, buckets.length, loadFactor());
        out.printf("%-20s | %-10s | %-10s%n", "Name", "Position", "Bucket");
        out.println("-----------------------------------------------");
        for (int i = 0; i < buckets.length; i++) {
            for (Entry e = buckets[i]; e != null; e = e.next) {
                out.printf("%-20s | %-10d | %-10d%n", e.name, e.position, i);
            }
        }
        out.println();
    }

    public void displayStructure(PrintStream out) {
        checkAlive();
        out.println();
        out.println("=== HASH TABLE STRUCTURE ===");
        out.printf("Capacity: %d, Size: %d%n%n", buckets.length, size);
        for (int i = 0; i < buckets.length; i++) {
            StringBuilder line = new StringBuilder(String.format("Bucket[%2d]: ", i));
            if (buckets[i] == null) {
                line.append("(empty)");
            } else {
                for (Entry e = buckets[i]; e != null; e = e.next) {
                    line.append('[').append(e.name).append(':').append(e.position).append(']');
                    if (e.next != null) line.append(" -> ");
                }
            }
            out.println(line);
        }
        out.println();
    }

    @Override
    public void destroy() {
        checkAlive();
        for (int i = 0; i < buckets.length; i++) {
            Entry e = buckets[i];
            while (e != null) {
                Entry next = e.next;
                e.next = null;
                e = next;
            }
            buckets[i] = null;
        }
        buckets = null;
        size = 0;
    }

    private void checkName(String name) {
        checkAlive();
        if (name == null) throw new SymbolTableException("Symbol name must not be null");
    }

    private void checkAlive() {
        if (buckets == null) throw new SymbolTableException("Symbol table already destroyed");
    }
}
