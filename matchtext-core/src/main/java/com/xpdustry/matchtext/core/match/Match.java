package com.xpdustry.matchtext.core.match;

import java.util.Comparator;
import org.jspecify.annotations.Nullable;

/**
 * An occurrence of a gazetteer entry in a scanned sequence.
 *
 * @param start the index of the first matched element
 * @param end the index after the last matched element
 * @param match the matched slice of the input, as it appears in the input
 * @param entryData the data of the entry, or the default data of the matcher if the entry has none
 * @param matcherData the data shared by every match of the matcher
 * @param <S> the sequence type
 */
public record Match<S>(int start, int end, S match, @Nullable Object entryData, @Nullable Object matcherData)
        implements Comparable<Match<?>> {

    private static final Comparator<Match<?>> ORDER =
            Comparator.<Match<?>>comparingInt(Match::start).thenComparingInt(Match::end);

    public int length() {
        return this.end - this.start;
    }

    @Override
    public int compareTo(final Match<?> other) {
        return ORDER.compare(this, other);
    }
}
