package symtab.table;

import java.io.PrintStream;
import java.util.List;

/**
 * Maps unique names to the position they were first added at.
 * Positions start at 0 and follow insertion order of distinct names.
 */
public interface SymbolTable {
    int NOT_FOUND = -1;

    /**
     * Adds {@code name} if absent.
     *
     * @return the position of {@code name}; an existing name keeps its old position
     */
    int add(String name);

    /** @return the position of {@code name}, or {@link #NOT_FOUND} */
    int search(String name);

    default boolean contains(String name) { return search(name) != NOT_FOUND; }

    int size();

    default boolean isEmpty() { return size() == 0; }

    /** Snapshot of the stored symbols in the order {@link #display} prints them. */
    List<Symbol> symbols();

    void display(PrintStream out);

    /** Drops every node; any later call throws {@link SymbolTableException}. */
    void destroy();
}
