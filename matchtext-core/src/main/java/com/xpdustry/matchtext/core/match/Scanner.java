package com.xpdustry.matchtext.core.match;

import com.xpdustry.matchtext.core.collection.Trie;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Walks an input sequence once from left to right, following the trie from every candidate start index.
 * Holds no scan state, so a single instance can serve concurrent scans of an unmodified trie.
 */
final class Scanner<E, S> {

    private final Trie<E> trie;
    private final MatcherOptions<E> options;
    private final SequenceType<E, S> type;

    Scanner(final Trie<E> trie, final MatcherOptions<E> options, final SequenceType<E, S> type) {
        this.trie = trie;
        this.options = options;
        this.type = type;
    }

    <M> List<M> scan(
            final S sequence,
            final boolean all,
            final boolean skip,
            final int from,
            final int to,
            final MatchFactory<S, M> factory) {
        final List<M> matches = new ArrayList<>();
        final var length = this.type.length(sequence);
        final var last = Math.min(to, length - 1);
        if (from >= length || from > last) {
            return matches;
        }

        var i = from;
        while (i <= last) {
            final var first = this.type.elementAt(sequence, i);
            if (this.options.isIgnored(first)) {
                i++;
                continue;
            }

            var node = this.trie.child(Trie.ROOT, this.options.normalize(first));
            var cursor = i + 1;
            var longestNode = Trie.ABSENT;
            var longestEnd = i;

            while (node != Trie.ABSENT) {
                if (this.trie.isEntry(node)) {
                    if (all) {
                        matches.add(this.create(sequence, i, cursor, node, factory));
                    }
                    longestNode = node;
                    longestEnd = cursor;
                }
                while (cursor < length && this.options.isIgnored(this.type.elementAt(sequence, cursor))) {
                    cursor++;
                }
                if (cursor >= length) {
                    break;
                }
                node = this.trie.child(node, this.options.normalize(this.type.elementAt(sequence, cursor)));
                cursor++;
            }

            if (!all && longestNode != Trie.ABSENT) {
                matches.add(this.create(sequence, i, longestEnd, longestNode, factory));
            }
            i += skip ? Math.max(1, longestEnd - i) : 1;
        }

        return matches;
    }

    private <M> M create(
            final S sequence, final int start, final int end, final int node, final MatchFactory<S, M> factory) {
        return factory.create(
                start,
                end,
                this.type.slice(sequence, start, end),
                this.resolve(this.trie.data(node)),
                this.options.matcherData());
    }

    private @Nullable Object resolve(final @Nullable Object data) {
        return data == null ? this.options.defaultData() : data;
    }
}
