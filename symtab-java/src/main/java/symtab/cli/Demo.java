package symtab.cli;

import symtab.table.HashSymbolTable;
import symtab.table.SymbolTable;
import symtab.table.TreeSymbolTable;

import java.io.PrintStream;
import java.util.List;

/** Scripted add/search session printed the same way for both table kinds. */
public final class Demo {
    static final List<String> INITIAL = List.of("variable1", "count", "sum", "array", "index");
    static final List<String> MORE_TREE = List.of("result", "temp", "max", "min");
    static final List<String> MORE_HASH = List.of("result", "temp", "max", "min", "value", "data", "flag", "status");

    private final PrintStream out;

    public Demo(PrintStream out) { this.out = out; }

    public void runTree() {
        TreeSymbolTable st = new TreeSymbolTable();

        out.println("Symbol Table Management - BST Implementation");
        out.println("============================================");
        out.println();

        addInitial(st);
        st.display(out);
        searches(st);

        out.println();
        out.println("Adding more symbols...");
        MORE_TREE.forEach(st::add);
        st.display(out);

        st.destroy();
        out.println("Symbol Table destroyed. Program terminated.");
    }

    public void runHash() {
        HashSymbolTable st = new HashSymbolTable();
        st.setResizeListener((oldCapacity, newCapacity) ->
                out.println("Hash table resized to capacity: " + newCapacity));

        out.println("Symbol Table Management - Hash Table Implementation");
        out.println("====================================================");
        out.println();

        addInitial(st);
        st.display(out);
        st.displayStructure(out);
        searches(st);

        out.println();
        out.println("Adding more symbols (to trigger resize)...");
        MORE_HASH.forEach(st::add);
        st.display(out);
        st.displayStructure(out);

        st.destroy();
        out.println("Symbol Table destroyed. Program terminated.");
    }

    private void addInitial(SymbolTable st) {
        out.println("Adding symbols...");
        for (String name : INITIAL) {
            out.println("Added '" + name + "' at position: " + st.add(name));
        }

        out.println();
        out.println("Attempting to add duplicate 'count'...");
        out.println("'count' position: " + st.add("count") + " (already exists)");
    }

    private void searches(SymbolTable st) {
        out.println("Searching for symbols...");
        for (String name : List.of("sum", "nonexistent")) {
            int pos = st.search(name);
            if (pos != SymbolTable.NOT_FOUND) {
                out.println("Found '" + name + "' at position: " + pos);
            } else {
                out.println("'" + name + "' not found");
            }
        }
    }
}
