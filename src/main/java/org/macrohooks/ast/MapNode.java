package org.macrohooks.ast;

import org.macrohooks.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A braced map, e.g. an options map such as <code>{:times 3}</code>.
 *
 * @param entries The key/value pairs in source order.
 * @param sourceInfo The position of the opening brace.
 */
public record MapNode(
        List<Entry> entries,
        SourceInfo sourceInfo
) implements Node {

    /**
     * A single key/value pair of a map.
     *
     * @param key The key node.
     * @param value The value node.
     */
    public record Entry(Node key, Node value) {
        public Entry {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
        }
    }

    public MapNode {
        entries = List.copyOf(entries);
        sourceInfo = sourceInfo != null ? sourceInfo : SourceInfo.UNKNOWN;
    }

    @Override
    public NodeTag tag() {
        return NodeTag.MAP;
    }

    /**
     * Returns keys and values flattened in alternating order.
     */
    @Override
    public List<Node> getChildren() {
        List<Node> flat = new ArrayList<>(entries.size() * 2);
        for (Entry entry : entries) {
            flat.add(entry.key());
            flat.add(entry.value());
        }
        return flat;
    }

    /**
     * Rebuilds the map from an alternating key/value list as produced by {@link #getChildren()}.
     *
     * @throws IllegalArgumentException if {@code newChildren} has an odd size.
     */
    @Override
    public Node reconstructWithChildren(List<Node> newChildren) {
        if (newChildren.size() % 2 != 0) {
            throw new IllegalArgumentException("A map needs an even number of children, got " + newChildren.size());
        }
        List<Entry> rebuilt = new ArrayList<>(newChildren.size() / 2);
        for (int i = 0; i < newChildren.size(); i += 2) {
            rebuilt.add(new Entry(newChildren.get(i), newChildren.get(i + 1)));
        }
        return new MapNode(rebuilt, sourceInfo);
    }
}
