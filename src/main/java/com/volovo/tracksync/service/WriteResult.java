package com.volovo.tracksync.service;

/**
 * Counters of one or more writer flushes.
 *
 * @param matched   points whose key already existed
 * @param inserted  points stored under a new key
 * @param modified  matched rows whose values were updated
 * @param conflicts matched rows left untouched although the incoming coordinates differ
 */
public record WriteResult(int matched, int inserted, int modified, int conflicts) {

    public static final WriteResult EMPTY = new WriteResult(0, 0, 0, 0);

    public WriteResult plus(WriteResult other) {
        return new WriteResult(matched + other.matched, inserted + other.inserted,
                modified + other.modified, conflicts + other.conflicts);
    }

    public int total() {
        return matched + inserted;
    }
}
