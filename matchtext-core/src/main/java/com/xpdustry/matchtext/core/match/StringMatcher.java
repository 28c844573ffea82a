package com.xpdustry.matchtext.core.match;

/**
 * Matches entries character by character. Match offsets are character offsets in the input string.
 */
public final class StringMatcher extends SequenceMatcher<Character, String> {

    public StringMatcher() {
        this(MatcherOptions.defaults());
    }

    public StringMatcher(final MatcherOptions<Character> options) {
        super(SequenceType.CHARACTERS, options);
    }
}
