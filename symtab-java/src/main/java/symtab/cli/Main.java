package symtab.cli;

public final class Main {
    public static void main(String[] args) {
        Demo demo = new Demo(System.out);

        // 1. tree-backed table
        demo.runTree();
        System.out.println();

        // 2. hash-backed table, grows past the initial 10 buckets
        demo.runHash();
    }
}
