package com.xpdustry.matchtext.core.match;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class TokenMatcherTest {

    private static final List<List<String>> ENTRIES = List.of(
            List.of("Some"),
            List.of("word"),
            List.of("to"),
            List.of("add"),
            List.of("some", "word"),
            List.of("some", "word"));

    @Test
    void find_single_token() {
        final var matcher = new TokenMatcher(lowercase().build());
        this.addEntries(matcher, false);
        final var result = matcher.find(List.of("This", "contains", "Some", "text"), false, true);
        assertThat(result).containsExactly(new Match<>(2, 3, List.of("Some"), 0, null));
    }

    @Test
    void find_case_sensitive() {
        final var matcher = new TokenMatcher();
        this.addEntries(matcher, false);
        final var result = matcher.find(List.of("This", "contains", "Some", "text"));
        assertThat(result).containsExactly(new Match<>(2, 3, List.of("Some"), 0, null));
        Assertions.assertTrue(matcher.find(List.of("some", "text")).isEmpty());
    }

    @Test
    void find_all_appended() {
        final var matcher = new TokenMatcher(lowercase().matcherData("x").build());
        this.addEntries(matcher, true);
        final var tokens = List.of("this", "contains", "some", "word", "of", "text", "to", "add");
        final var result = matcher.find(tokens, true, false);
        assertThat(result)
                .containsExactly(
                        new Match<>(2, 3, List.of("some"), List.of(0), "x"),
                        new Match<>(2, 4, List.of("some", "word"), List.of(4, 5), "x"),
                        new Match<>(3, 4, List.of("word"), List.of(1), "x"),
                        new Match<>(6, 7, List.of("to"), List.of(2), "x"),
                        new Match<>(7, 8, List.of("add"), List.of(3), "x"));
    }

    @Test
    void find_longest_multi_token() {
        final var matcher = new TokenMatcher(lowercase().build());
        this.addEntries(matcher, false);
        final var tokens = List.of("Some", "Word", "to", "add");
        assertThat(matcher.find(tokens))
                .extracting(Match::start, Match::end, Match::entryData)
                .containsExactly(tuple(0, 2, 5), tuple(2, 3, 2), tuple(3, 4, 3));
    }

    @Test
    void find_ignored_tokens() {
        final var matcher = new TokenMatcher(lowercase().ignore(String::isBlank).build());
        matcher.add(List.of("new", " ", "york"), "city");
        final var tokens = List.of("", "New", "", "York", " ", "is");
        assertThat(matcher.find(tokens))
                .containsExactly(new Match<>(1, 4, List.of("New", "", "York"), "city", null));
        Assertions.assertEquals("city", matcher.get(List.of("NEW", "YORK")));
    }

    @Test
    void add_single_token() {
        final var matcher = new TokenMatcher();
        matcher.add("word", 1);
        matcher.add("word", 2, true);
        Assertions.assertEquals(List.of(2), matcher.get(List.of("word")));
        Assertions.assertTrue(matcher.contains(List.of("word"), false));
        Assertions.assertFalse(matcher.contains(List.of("word", "s"), true));
    }

    @Test
    void replace_tokens() {
        final var matcher = new TokenMatcher(lowercase().build());
        matcher.add(List.of("new", "york"), "NYC");
        final var tokens = List.of("I", "love", "New", "York", ".");
        Assertions.assertEquals(List.of("I", "love", "NYC", "."), matcher.replace(tokens));
        Assertions.assertEquals(
                List.of("I", "love", "[", "New", "York", "]", "."),
                matcher.replace(tokens, match -> {
                    final var replacement = new ArrayList<String>();
                    replacement.add("[");
                    replacement.addAll(match.match());
                    replacement.add("]");
                    return replacement;
                }));
    }

    private void addEntries(final TokenMatcher matcher, final boolean append) {
        for (int i = 0; i < ENTRIES.size(); i++) {
            matcher.add(ENTRIES.get(i), i, append);
        }
    }

    private static MatcherOptions.Builder<String> lowercase() {
        return MatcherOptions.<String>builder().map(token -> token.toLowerCase(Locale.ROOT));
    }
}
