package symtab.table;

public record Symbol(String name, int position) {}
