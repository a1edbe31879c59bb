package admission.java.engine;

import admission.core.algorithms.sliding_window.SessionLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Registry of session ledgers, keyed by session id.
 *
 * <ul>
 *   <li>Lazy creation: the first lookup of an id binds a fresh, empty ledger</li>
 *   <li>Atomic creation: racing callers for a new id all get the same entry</li>
 *   <li>Bounded: beyond {@code maxSessions} the least recently used session is dropped</li>
 * </ul>
 *
 * <p>Map operations are synchronized on the store; the ledgers themselves are
 * guarded by each entry's own lock, so sessions never wait on each other
 * once their entry has been resolved.
 *
 * <p>A dropped session starts over with an empty ledger if it comes back,
 * so under churn from more than {@code maxSessions} live sessions a session's
 * limits can reset inside its window. Size the bound above the number of
 * sessions active in one window.
 */
public final class SessionStore {

    private static final Logger logger = LoggerFactory.getLogger(SessionStore.class);

    private final int maxSessions;
    private final LinkedHashMap<String, SessionEntry> sessions;

    /**
     * @param maxSessions Maximum number of sessions tracked at once (must be > 0)
     * @throws IllegalArgumentException if maxSessions <= 0
     */
    public SessionStore(int maxSessions) {
        if (maxSessions <= 0) {
            throw new IllegalArgumentException("maxSessions must be > 0");
        }
        this.maxSessions = maxSessions;

        // accessOrder=true: iteration order is least recently used first
        this.sessions = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, SessionEntry> eldest) {
                boolean drop = size() > SessionStore.this.maxSessions;
                if (drop) {
                    logger.debug("Session store full ({}), dropping least recently used session {}",
                        SessionStore.this.maxSessions, eldest.getKey());
                }
                return drop;
            }
        };
    }

    /**
     * Returns the entry bound to a session, binding an empty ledger first if
     * the session has not been seen. Marks the session as recently used.
     */
    synchronized SessionEntry getOrCreate(String sessionId) {
        SessionEntry entry = sessions.get(sessionId);
        if (entry == null) {
            entry = new SessionEntry(new SessionLedger());
            sessions.put(sessionId, entry);
        }
        return entry;
    }

    /**
     * @return true if {@code entry} is still the one bound to the session,
     *         i.e. it was not dropped or replaced since it was resolved
     */
    synchronized boolean isBound(String sessionId, SessionEntry entry) {
        return sessions.get(sessionId) == entry;
    }

    /**
     * @return the entry, or null if the session is not tracked
     */
    synchronized SessionEntry get(String sessionId) {
        return sessions.get(sessionId);
    }

    /**
     * Replaces the ledger bound to a session, binding the session if needed.
     * Waits for any in-flight check on that session to finish first.
     */
    public void put(String sessionId, SessionLedger ledger) {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }
        if (ledger == null) {
            throw new IllegalArgumentException("ledger cannot be null");
        }
        SessionEntry entry = getOrCreate(sessionId);
        entry.lock().lock();
        try {
            entry.replaceLedger(ledger);
        } finally {
            entry.lock().unlock();
        }
    }

    /**
     * Ends a session. Does not count as an LRU drop.
     *
     * @return true if the session was tracked
     */
    public synchronized boolean remove(String sessionId) {
        return sessions.remove(sessionId) != null;
    }

    /**
     * Does NOT mark the session as recently used.
     */
    public synchronized boolean contains(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    public synchronized int size() {
        return sessions.size();
    }

    public int maxSessions() {
        return maxSessions;
    }

    public synchronized void clear() {
        sessions.clear();
    }
}
