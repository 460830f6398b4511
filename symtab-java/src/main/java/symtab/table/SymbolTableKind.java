package symtab.table;

public enum SymbolTableKind {
    TREE,
    HASH;

    public SymbolTable create() {
        return switch (this) {
            case TREE -> new TreeSymbolTable();
            case HASH -> new HashSymbolTable();
        };
    }
}
