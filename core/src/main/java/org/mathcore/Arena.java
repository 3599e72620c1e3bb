package org.mathcore;

import java.util.*;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Owns every node built during one conversion.
 *
 * <p>Nodes are appended, never removed, and refer to each other by index. A node may
 * only refer to nodes already in the arena, so the tree is acyclic by construction.
 */
final class Arena {
    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .disableHtmlEscaping()
        .registerTypeHierarchyAdapter(Optional.class, new OptionalAdapter())
        .create();

    private final ArrayList<Node> nodes = new ArrayList<>();

    int push(Node node) {
        var index = this.nodes.size();
        for (var child : node.children()) {
            if (child < 0 || child >= index) {
                throw new IllegalStateException(
                    String.format("node %d refers to %d, which is not allocated yet", index, child)
                );
            }
        }
        this.nodes.add(node);
        return index;
    }

    Node get(int index) {
        return this.nodes.get(index);
    }

    int size() {
        return this.nodes.size();
    }

    @Override
    public String toString() {
        var dump = new LinkedHashMap<Integer, Object>();
        for (int i = 0; i < this.nodes.size(); i++) {
            var node = this.nodes.get(i);
            dump.put(i, Map.of(node.getClass().getSimpleName(), node));
        }
        return GSON.toJson(dump);
    }
}
