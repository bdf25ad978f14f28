package tyrepl.infer;

import static com.google.common.base.Preconditions.checkElementIndex;

/** Disjoint-set forest over {@code [0, size)} with path compression and no rank. */
public final class UnionFind {

    private final int[] parent;

    public UnionFind(int size) {
        parent = new int[size];
        for (int i = 0; i < size; i++) {
            parent[i] = i;
        }
    }

    public int size() {
        return parent.length;
    }

    public int find(int x) {
        checkElementIndex(x, parent.length);
        int root = x;
        while (parent[root] != root) {
            root = parent[root];
        }
        int i = x;
        while (parent[i] != root) {
            int next = parent[i];
            parent[i] = root;
            i = next;
        }
        return root;
    }

    int parent(int x) {
        checkElementIndex(x, parent.length);
        return parent[x];
    }

    /** Merges the sets of {@code x} and {@code y}; the root of {@code y} stays the root. */
    public void join(int x, int y) {
        parent[find(x)] = find(y);
    }
}
