package com.xpdustry.matchtext.core.match;

import com.google.common.base.Preconditions;
import com.xpdustry.matchtext.core.collection.Trie;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds occurrences of gazetteer entries in sequences of elements.
 * <p>
 * Entries and inputs are normalized the same way: elements accepted by the ignore predicate of the
 * {@link MatcherOptions options} are skipped, the others go through the map function before being compared.
 * <p>
 * Not thread-safe. Concurrent {@code find} and {@code replace} calls are fine as long as no entry is added or set
 * meanwhile, callers mixing both must serialize them, with a read-write lock for example.
 *
 * @param <E> the element type
 * @param <S> the sequence type, used for entries, inputs and outputs
 */
public class SequenceMatcher<E, S> {

    private static final Logger LOGGER = LoggerFactory.getLogger(SequenceMatcher.class);

    private final Trie.Mutable<E> trie = Trie.create();
    private final SequenceType<E, S> type;
    private final MatcherOptions<E> options;
    private final Scanner<E, S> scanner;
    private final Replacer<S> replacer;

    public SequenceMatcher(final SequenceType<E, S> type, final MatcherOptions<E> options) {
        this.type = Preconditions.checkNotNull(type, "type");
        this.options = Preconditions.checkNotNull(options, "options");
        this.scanner = new Scanner<>(this.trie, options, type);
        this.replacer = new Replacer<>(type);
    }

    public void add(final S entry, final @Nullable Object data) {
        this.add(entry, data, false);
    }

    /**
     * Adds an entry. If it already exists, its data is replaced, or appended to the list of its previous data when
     * {@code append} is true. Entries made only of ignored elements are dropped.
     */
    public void add(final S entry, final @Nullable Object data, final boolean append) {
        Preconditions.checkNotNull(entry, "entry");
        final var node = this.insert(entry);
        if (node == Trie.ROOT) {
            LOGGER.debug("Dropped empty entry {}", entry);
            return;
        }
        if (append) {
            this.trie.append(node, data);
        } else {
            this.trie.set(node, data);
        }
    }

    public void addAll(final Iterable<? extends S> entries, final @Nullable Object data, final boolean append) {
        Preconditions.checkNotNull(entries, "entries");
        for (final var entry : entries) {
            this.add(entry, data, append);
        }
    }

    /**
     * Sets the data of an entry, replacing any accumulated list.
     */
    public void set(final S key, final @Nullable Object data) {
        this.add(key, data, false);
    }

    /**
     * Returns the data of the entry matching {@code key}.
     *
     * @throws EntryNotFoundException if there is no such entry
     */
    public @Nullable Object get(final S key) {
        final var node = this.lookup(key);
        if (node == Trie.ABSENT || !this.trie.isEntry(node)) {
            throw new EntryNotFoundException(key);
        }
        return this.trie.data(node);
    }

    public @Nullable Object get(final S key, final @Nullable Object fallback) {
        final var node = this.lookup(key);
        if (node == Trie.ABSENT || !this.trie.isEntry(node)) {
            return fallback;
        }
        return this.trie.data(node);
    }

    /**
     * Tells whether an entry matches {@code key}, or with {@code partial}, whether some entry starts with it.
     */
    public boolean contains(final S key, final boolean partial) {
        final var node = this.lookup(key);
        return node != Trie.ABSENT && (partial || this.trie.isEntry(node));
    }

    public int size() {
        return this.trie.entries();
    }

    public List<Match<S>> find(final S sequence) {
        return this.find(sequence, false, true);
    }

    public List<Match<S>> find(final S sequence, final boolean all, final boolean skip) {
        return this.find(sequence, all, skip, 0, Integer.MAX_VALUE);
    }

    public List<Match<S>> find(
            final S sequence, final boolean all, final boolean skip, final int from, final int to) {
        return this.find(sequence, all, skip, from, to, Match::new);
    }

    /**
     * Finds the entries occurring in {@code sequence}, in increasing start order.
     *
     * @param all keep every entry found at a start index, shortest first, instead of the longest one only
     * @param skip resume after the longest match found at a start index instead of at the next index
     * @param from the first index where a match may start
     * @param to the last index where a match may start, clamped to the sequence
     * @param factory creates the returned values
     */
    public <M> List<M> find(
            final S sequence,
            final boolean all,
            final boolean skip,
            final int from,
            final int to,
            final MatchFactory<S, M> factory) {
        Preconditions.checkNotNull(sequence, "sequence");
        Preconditions.checkNotNull(factory, "factory");
        Preconditions.checkArgument(from >= 0, "from must be non-negative, got %s", from);
        LOGGER.debug("Scanning {} elements from {} to {}", this.type.length(sequence), from, to);
        final var matches = this.scanner.scan(sequence, all, skip, from, to, factory);
        LOGGER.debug("Found {} matches", matches.size());
        return matches;
    }

    public S replace(final S sequence) {
        return this.replace(sequence, match -> this.type.render(match.entryData()));
    }

    public S replace(final S sequence, final Function<? super Match<S>, ? extends S> replacement) {
        return this.replace(sequence, 0, Integer.MAX_VALUE, replacement);
    }

    /**
     * Replaces the longest non-overlapping matches found between {@code from} and {@code to}.
     *
     * @return the rebuilt sequence, or {@code sequence} itself when nothing matched
     */
    public S replace(
            final S sequence,
            final int from,
            final int to,
            final Function<? super Match<S>, ? extends S> replacement) {
        Preconditions.checkNotNull(replacement, "replacement");
        return this.replacer.replace(sequence, this.find(sequence, false, true, from, to), replacement);
    }

    public MatcherOptions<E> options() {
        return this.options;
    }

    public Trie<E> trie() {
        return this.trie;
    }

    @Override
    public String toString() {
        return this.trie.toString();
    }

    private int insert(final S entry) {
        var node = Trie.ROOT;
        final var length = this.type.length(entry);
        for (int i = 0; i < length; i++) {
            final var element = this.type.elementAt(entry, i);
            if (this.options.isIgnored(element)) {
                continue;
            }
            node = this.trie.insert(node, this.options.normalize(element));
        }
        return node;
    }

    private int lookup(final S key) {
        Preconditions.checkNotNull(key, "key");
        final var length = this.type.length(key);
        final List<E> path = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            final var element = this.type.elementAt(key, i);
            if (!this.options.isIgnored(element)) {
                path.add(this.options.normalize(element));
            }
        }
        return this.trie.lookup(path);
    }
}
