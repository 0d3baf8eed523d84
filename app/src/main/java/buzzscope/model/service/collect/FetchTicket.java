package buzzscope.model.service.collect;

import buzzscope.model.repository.CacheException;

/**
 * Guards the cache write of one platform unit. Once abandoned the unit can no
 * longer write; once committed it can no longer be abandoned.
 */
final class FetchTicket {

    @FunctionalInterface
    interface Write<T> {
        T run() throws CacheException;
    }

    private boolean abandoned;
    private boolean committed;

    /**
     * Runs {@code write} unless the ticket was abandoned. Returns false when it was.
     * The write runs under the ticket's lock, so {@link #abandon()} waits for it.
     */
    synchronized <T> boolean commit(Write<T> write) throws CacheException {
        if (abandoned) return false;
        committed = true;
        write.run();
        return true;
    }

    /** Returns false when the unit already committed its write. */
    synchronized boolean abandon() {
        if (committed) return false;
        abandoned = true;
        return true;
    }

    synchronized boolean isAbandoned() { return abandoned; }
}
