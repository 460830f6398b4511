package symtab.table;

import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Unbalanced binary search tree ordered by {@link String#compareTo}.
 * Shape depends only on insertion order; sorted input degrades to a list.
 */
public final class TreeSymbolTable implements SymbolTable {

    private static final class Node {
        final String name;
        final int position;
        Node left;
        Node right;

        Node(String name, int position) {
            this.name = name;
            this.position = position;
        }
    }

    private Node root;
    private int size;
    private boolean destroyed;

    @Override
    public int add(String name) {
        checkName(name);
        if (root == null) {
            root = new Node(name, size++);
            return root.position;
        }
        Node cur = root;
        while (true) {
            int cmp = name.compareTo(cur.name);
            if (cmp == 0) return cur.position;
            if (cmp < 0) {
                if (cur.left == null) {
                    cur.left = new Node(name, size++);
                    return cur.left.position;
                }
                cur = cur.left;
            } else {
                if (cur.right == null) {
                    cur.right = new Node(name, size++);
                    return cur.right.position;
                }
                cur = cur.right;
            }
        }
    }

    @Override
    public int search(String name) {
        checkName(name);
        Node cur = root;
        while (cur != null) {
            int cmp = name.compareTo(cur.name);
            if (cmp == 0) return cur.position;
            cur = cmp < 0 ? cur.left : cur.right;
        }
        return NOT_FOUND;
    }

    @Override
    public int size() {
        checkAlive();
        return size;
    }

    /** Nodes on the longest root-to-leaf path, 0 for an empty tree. */
    public int height() {
        checkAlive();
        if (root == null) return 0;
        int height = 0;
        Deque<Node> level = new ArrayDeque<>();
        level.add(root);
        while (!level.isEmpty()) {
            height++;
            for (int i = level.size(); i > 0; i--) {
                Node n = level.poll();
                if (n.left != null) level.add(n.left);
                if (n.right != null) level.add(n.right);
            }
        }
        return height;
    }

    @Override
    public List<Symbol> symbols() {
        checkAlive();
        List<Symbol> out = new ArrayList<>(size);
        Deque<Node> stack = new ArrayDeque<>();
        Node cur = root;
        while (cur != null || !stack.isEmpty()) {
            while (cur != null) {
                stack.push(cur);
                cur = cur.left;
            }
            cur = stack.pop();
            out.add(new Symbol(cur.name, cur.position));
            cur = cur.right;
        }
        return Collections.unmodifiableList(out);
    }

    @Override
    public void display(PrintStream out) {
        List<Symbol> symbols = symbols();
        out.println();
        out.println("=== SYMBOL TABLE (BST) ===");
        out.println("Size: " + size);
        out.printf("%-20s | %-10s%n", "Name", "Position");
        out.println("------------------------------------");
        for (Symbol s : symbols) {
            out.printf("%-20s | %-10d%n", s.name(), s.position());
        }
        out.println();
    }

    @Override
    public void destroy() {
        checkAlive();
        // each node is visited exactly once
        Deque<Node> stack = new ArrayDeque<>();
        if (root != null) stack.push(root);
        while (!stack.isEmpty()) {
            Node n = stack.pop();
            if (n.left != null) stack.push(n.left);
            if (n.right != null) stack.push(n.right);
            n.left = null;
            n.right = null;
        }
        root = null;
        size = 0;
        destroyed = true;
    }

    private void checkName(String name) {
        checkAlive();
        if (name == null) throw new SymbolTableException("Symbol name must not be null");
    }

    private void checkAlive() {
        if (destroyed) throw new SymbolTableException("Symbol table already destroyed");
    }
}
