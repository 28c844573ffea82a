package com.xpdustry.matchtext.core.match;

import com.google.common.base.Preconditions;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import org.jspecify.annotations.Nullable;

/**
 * Construction parameters of a matcher.
 *
 * @param ignore elements for which it holds are skipped when adding, looking up and scanning
 * @param map normalizes every retained element before it is compared
 * @param matcherData attached to every match of the matcher
 * @param defaultData substituted in matches whose entry data is null
 */
public record MatcherOptions<E>(
        Predicate<? super E> ignore,
        UnaryOperator<E> map,
        @Nullable Object matcherData,
        @Nullable Object defaultData) {

    public MatcherOptions {
        Preconditions.checkNotNull(ignore, "ignore");
        Preconditions.checkNotNull(map, "map");
    }

    public static <E> MatcherOptions<E> defaults() {
        return MatcherOptions.<E>builder().build();
    }

    public static <E> Builder<E> builder() {
        return new Builder<>();
    }

    boolean isIgnored(final E element) {
        return this.ignore.test(element);
    }

    E normalize(final E element) {
        return this.map.apply(element);
    }

    public static final class Builder<E> {

        private Predicate<? super E> ignore = element -> false;
        private UnaryOperator<E> map = UnaryOperator.identity();
        private @Nullable Object matcherData = null;
        private @Nullable Object defaultData = null;

        private Builder() {}

        public Builder<E> ignore(final Predicate<? super E> ignore) {
            this.ignore = Preconditions.checkNotNull(ignore, "ignore");
            return this;
        }

        public Builder<E> map(final UnaryOperator<E> map) {
            this.map = Preconditions.checkNotNull(map, "map");
            return this;
        }

        public Builder<E> matcherData(final @Nullable Object matcherData) {
            this.matcherData = matcherData;
            return this;
        }

        public Builder<E> defaultData(final @Nullable Object defaultData) {
            this.defaultData = defaultData;
            return this;
        }

        public MatcherOptions<E> build() {
            return new MatcherOptions<>(this.ignore, this.map, this.matcherData, this.defaultData);
        }
    }
}
