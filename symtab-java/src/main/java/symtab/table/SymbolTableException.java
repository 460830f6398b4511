package symtab.table;

public class SymbolTableException extends RuntimeException {
    public SymbolTableException(String message) { super(message); }
}
