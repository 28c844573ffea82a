package com.xpdustry.matchtext.core.match;

import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Describes how a matcher reads and builds sequences of elements.
 *
 * @param <E> the element type
 * @param <S> the sequence type
 */
public interface SequenceType<E, S> {

    SequenceType<Character, String> CHARACTERS = new Characters();

    SequenceType<String, List<String>> TOKENS = new Tokens();

    int length(final S sequence);

    E elementAt(final S sequence, final int index);

    S slice(final S sequence, final int start, final int end);

    S concat(final List<S> parts);

    /**
     * Returns the default replacement of a match carrying the given entry data.
     */
    S render(final @Nullable Object data);

    final class Characters implements SequenceType<Character, String> {

        private Characters() {}

        @Override
        public int length(final String sequence) {
            return sequence.length();
        }

        @Override
        public Character elementAt(final String sequence, final int index) {
            return sequence.charAt(index);
        }

        @Override
        public String slice(final String sequence, final int start, final int end) {
            return sequence.substring(start, end);
        }

        @Override
        public String concat(final List<String> parts) {
            final var builder = new StringBuilder();
            for (final var part : parts) {
                builder.append(part);
            }
            return builder.toString();
        }

        @Override
        public String render(final @Nullable Object data) {
            return String.valueOf(data);
        }
    }

    final class Tokens implements SequenceType<String, List<String>> {

        private Tokens() {}

        @Override
        public int length(final List<String> sequence) {
            return sequence.size();
        }

        @Override
        public String elementAt(final List<String> sequence, final int index) {
            return sequence.get(index);
        }

        @Override
        public List<String> slice(final List<String> sequence, final int start, final int end) {
            return List.copyOf(sequence.subList(start, end));
        }

        @Override
        public List<String> concat(final List<List<String>> parts) {
            final List<String> tokens = new ArrayList<>();
            for (final var part : parts) {
                tokens.addAll(part);
            }
            return List.copyOf(tokens);
        }

        @Override
        public List<String> render(final @Nullable Object data) {
            return List.of(String.valueOf(data));
        }
    }
}
