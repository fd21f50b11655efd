package com.ai.assistant.service;

import com.ai.assistant.config.DialogueProperties;
import com.ai.assistant.conversation.ConversationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * One {@link ConversationContext} per session id. Contexts are created on first use and dropped when
 * the session ends or sits idle past the timeout; work on a context runs under that session's lock so
 * turns of one session never interleave while different sessions proceed in parallel.
 */
@Component
public class ConversationContextStore {

    private static final Logger log = LoggerFactory.getLogger(ConversationContextStore.class);

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final DialogueProperties properties;

    @Value("${assistant.context.idle-timeout:30m}")
    private Duration idleTimeout = Duration.ofMinutes(30);

    public ConversationContextStore(DialogueProperties properties) {
        this.properties = properties;
    }

    /** Runs {@code work} against the session's context while holding its lock. Re-entrant for the same thread. */
    public <T> T withSession(String sessionId, Function<ConversationContext, T> work) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId is required");
        }
        while (true) {
            Session session = sessions.computeIfAbsent(sessionId, this::newSession);
            session.lock.lock();
            try {
                // removed while we waited for the lock; pick up the replacement
                if (session.closed) continue;
                session.lastUsed = Instant.now();
                return work.apply(session.context);
            } finally {
                session.lock.unlock();
            }
        }
    }

    public boolean contains(String sessionId) {
        return sessionId != null && sessions.containsKey(sessionId);
    }

    /**
     * Ends the session; its context is discarded. Waits for a turn in progress on it to finish.
     * Returns false when there was none.
     */
    public boolean remove(String sessionId) {
        if (sessionId == null) return false;
        Session session = sessions.get(sessionId);
        if (session == null) return false;
        session.lock.lock();
        try {
            if (session.closed) return false;
            close(sessionId, session);
        } finally {
            session.lock.unlock();
        }
        log.info("[{}] Session ended", sessionId);
        return true;
    }

    public int size() {
        return sessions.size();
    }

    @Scheduled(initialDelayString = "${assistant.context.sweep-interval-ms:60000}",
            fixedDelayString = "${assistant.context.sweep-interval-ms:60000}")
    public void evictIdleSessions() {
        int evicted = evictIdle(Instant.now());
        if (evicted > 0) {
            log.info("Evicted {} idle sessions, {} remain", evicted, size());
        }
    }

    /** Drops sessions unused since {@code now - idleTimeout}. Sessions busy with a turn are skipped. */
    int evictIdle(Instant now) {
        Instant cutoff = now.minus(idleTimeout);
        int evicted = 0;
        for (Map.Entry<String, Session> e : sessions.entrySet()) {
            Session session = e.getValue();
            if (!session.lastUsed.isBefore(cutoff) || !session.lock.tryLock()) continue;
            try {
                if (!session.closed && session.lastUsed.isBefore(cutoff)) {
                    close(e.getKey(), session);
                    log.debug("[{}] Session idle since {}, evicted", e.getKey(), session.lastUsed);
                    evicted++;
                }
            } finally {
                session.lock.unlock();
            }
        }
        return evicted;
    }

    void setIdleTimeout(Duration idleTimeout) {
        this.idleTimeout = idleTimeout;
    }

    private void close(String sessionId, Session session) {
        session.closed = true;
        sessions.remove(sessionId, session);
    }

    private Session newSession(String sessionId) {
        log.info("[{}] New session", sessionId);
        return new Session(new ConversationContext(sessionId, properties.getHistoryWindow(), properties.isRefinementEnabled()));
    }

    private static final class Session {
        private final ReentrantLock lock = new ReentrantLock();
        private final ConversationContext context;
        private volatile Instant lastUsed = Instant.now();
        private volatile boolean closed;

        private Session(ConversationContext context) {
            this.context = context;
        }
    }
}
