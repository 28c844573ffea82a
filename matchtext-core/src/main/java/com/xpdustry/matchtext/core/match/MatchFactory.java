package com.xpdustry.matchtext.core.match;

import org.jspecify.annotations.Nullable;

/**
 * Creates the result values of a scan, {@code Match::new} being the default.
 */
@FunctionalInterface
public interface MatchFactory<S, M> {

    M create(
            final int start,
            final int end,
            final S match,
            final @Nullable Object entryData,
            final @Nullable Object matcherData);
}
