package com.xpdustry.matchtext.core.match;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

final class Replacer<S> {

    private final SequenceType<?, S> type;

    Replacer(final SequenceType<?, S> type) {
        this.type = type;
    }

    /**
     * Stitches the unmatched slices of {@code sequence} with the replacements of {@code matches}, which must be
     * ordered by start index. A match starting before the end of the previously replaced one is dropped.
     */
    S replace(
            final S sequence,
            final List<Match<S>> matches,
            final Function<? super Match<S>, ? extends S> replacement) {
        if (matches.isEmpty()) {
            return sequence;
        }

        final List<S> parts = new ArrayList<>();
        var last = 0;
        for (final var match : matches) {
            if (match.start() < last) {
                continue;
            }
            if (match.start() > last) {
                parts.add(this.type.slice(sequence, last, match.start()));
            }
            parts.add(replacement.apply(match));
            last = match.end();
        }

        final var length = this.type.length(sequence);
        if (last < length) {
            parts.add(this.type.slice(sequence, last, length));
        }
        return this.type.concat(parts);
    }
}
