package com.xpdustry.matchtext.core.collection;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A prefix tree keyed by elements of type {@code E}. Nodes are addressed by integer handles, {@link #ROOT} being the
 * empty prefix. A node may mark the end of an entry, in which case it carries the entry data, which may be null.
 * <p>
 * Implementations are not thread-safe, concurrent reads are fine as long as nobody mutates the trie.
 *
 * @param <E> the element type, must have consistent {@code equals} and {@code hashCode}
 */
public interface Trie<E> {

    int ROOT = 0;

    int ABSENT = -1;

    static <E> Trie.Mutable<E> create() {
        return new ArenaTrie<>();
    }

    /**
     * Returns the child of {@code node} reached through {@code element}, or {@link #ABSENT}.
     */
    int child(final int node, final E element);

    /**
     * Follows the path spelled by {@code elements} from the root.
     *
     * @return the node at the end of the path, or {@link #ABSENT} if a step has no matching child
     */
    default int lookup(final List<? extends E> elements) {
        var node = ROOT;
        for (final var element : elements) {
            node = this.child(node, element);
            if (node == ABSENT) {
                return ABSENT;
            }
        }
        return node;
    }

    boolean isEntry(final int node);

    boolean isAccumulated(final int node);

    /**
     * Returns the data of the entry ending at {@code node}, null if there is none or if its data is null.
     * Use {@link #isEntry(int)} to tell both cases apart. Accumulated data is returned as a read-only copy.
     */
    @Nullable Object data(final int node);

    int nodes();

    int entries();

    interface Mutable<E> extends Trie<E> {

        /**
         * Returns the child of {@code node} reached through {@code element}, creating it if needed.
         */
        int insert(final int node, final E element);

        /**
         * Marks {@code node} as an entry and replaces its data.
         *
         * @return the previous data, null if there was none
         */
        @Nullable Object set(final int node, final @Nullable Object data);

        /**
         * Marks {@code node} as an entry and appends {@code data} to its accumulated list. A node without data, or
         * with data that was {@link #set(int, Object) set}, starts a new list.
         */
        void append(final int node, final @Nullable Object data);
    }
}
