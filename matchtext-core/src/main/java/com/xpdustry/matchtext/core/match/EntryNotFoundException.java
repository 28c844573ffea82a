package com.xpdustry.matchtext.core.match;

/**
 * Thrown by exact lookups when no entry ends at the requested key.
 */
public final class EntryNotFoundException extends RuntimeException {

    private final Object key;

    public EntryNotFoundException(final Object key) {
        super("No entry found for " + key);
        this.key = key;
    }

    public Object key() {
        return key;
    }
}
