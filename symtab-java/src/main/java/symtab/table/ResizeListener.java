package symtab.table;

@FunctionalInterface
public interface ResizeListener {
    void resized(int oldCapacity, int newCapacity);
}
