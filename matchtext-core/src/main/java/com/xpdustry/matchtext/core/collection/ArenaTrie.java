package com.xpdustry.matchtext.core.collection;

import com.google.common.base.Preconditions;
import gnu.trove.impl.Constants;
import gnu.trove.map.TObjectIntMap;
import gnu.trove.map.hash.TObjectIntHashMap;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;

final class ArenaTrie<E> implements Trie.Mutable<E> {

    private final List<@Nullable TObjectIntMap<E>> children = new ArrayList<>();
    private final List<@Nullable Object> values = new ArrayList<>();
    private final BitSet entries = new BitSet();
    private final BitSet accumulated = new BitSet();

    ArenaTrie() {
        this.allocate();
    }

    @Override
    public int child(final int node, final E element) {
        Preconditions.checkNotNull(element, "element");
        final var table = this.children.get(node);
        return table == null ? ABSENT : table.get(element);
    }

    @Override
    public int insert(final int node, final E element) {
        Preconditions.checkNotNull(element, "element");
        var table = this.children.get(node);
        if (table == null) {
            table = new TObjectIntHashMap<>(Constants.DEFAULT_CAPACITY, Constants.DEFAULT_LOAD_FACTOR, ABSENT);
            this.children.set(node, table);
        }
        var next = table.get(element);
        if (next == ABSENT) {
            next = this.allocate();
            table.put(element, next);
        }
        return next;
    }

    @Override
    public boolean isEntry(final int node) {
        return this.entries.get(node);
    }

    @Override
    public boolean isAccumulated(final int node) {
        return this.accumulated.get(node);
    }

    @Override
    public @Nullable Object data(final int node) {
        final var value = this.values.get(node);
        if (this.accumulated.get(node)) {
            return Collections.unmodifiableList(new ArrayList<>((List<?>) value));
        }
        return value;
    }

    @Override
    public @Nullable Object set(final int node, final @Nullable Object data) {
        this.checkEntryNode(node);
        final var previous = this.data(node);
        this.values.set(node, data);
        this.entries.set(node);
        this.accumulated.clear(node);
        return previous;
    }

    @Override
    @SuppressWarnings("unchecked")
    public void append(final int node, final @Nullable Object data) {
        this.checkEntryNode(node);
        if (this.accumulated.get(node)) {
            ((List<@Nullable Object>) this.values.get(node)).add(data);
            return;
        }
        final List<@Nullable Object> list = new ArrayList<>();
        list.add(data);
        this.values.set(node, list);
        this.entries.set(node);
        this.accumulated.set(node);
    }

    @Override
    public int nodes() {
        return this.values.size();
    }

    @Override
    public int entries() {
        return this.entries.cardinality();
    }

    @Override
    public String toString() {
        final var builder = new StringBuilder();
        this.render(ROOT, builder);
        return builder.toString();
    }

    private void render(final int node, final StringBuilder builder) {
        builder.append('{');
        if (this.entries.get(node)) {
            builder.append(this.data(node)).append(", ");
        }
        builder.append("children=[");
        final var table = this.children.get(node);
        if (table != null) {
            final var first = new boolean[] {true};
            table.forEachEntry((element, child) -> {
                if (!first[0]) {
                    builder.append(", ");
                }
                first[0] = false;
                builder.append(element).append(" -> ");
                this.render(child, builder);
                return true;
            });
        }
        builder.append("]}");
    }

    private void checkEntryNode(final int node) {
        Preconditions.checkElementIndex(node, this.values.size(), "node");
        Preconditions.checkArgument(node != ROOT, "The root node cannot carry entry data");
    }

    private int allocate() {
        this.children.add(null);
        this.values.add(null);
        return this.values.size() - 1;
    }
}
