package com.xpdustry.matchtext.core.match;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Matches entries made of one or more tokens against token lists. Match offsets are token offsets.
 */
public final class TokenMatcher extends SequenceMatcher<String, List<String>> {

    public TokenMatcher() {
        this(MatcherOptions.defaults());
    }

    public TokenMatcher(final MatcherOptions<String> options) {
        super(SequenceType.TOKENS, options);
    }

    public void add(final String token, final @Nullable Object data) {
        this.add(List.of(token), data, false);
    }

    public void add(final String token, final @Nullable Object data, final boolean append) {
        this.add(List.of(token), data, append);
    }
}
