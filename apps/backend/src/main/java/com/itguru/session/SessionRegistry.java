package com.itguru.session;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.itguru.config.SessionProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.Optional;
import java.util.UUID;

/**
 * In-memory session store with expire-after-access eviction. Nothing is persisted.
 */
@Slf4j
@Component
public class SessionRegistry {

    private final Cache<String, SessionContext> sessions;
    private final Scheduler scheduler;

    public SessionRegistry(SessionProperties props) {
        this.sessions = Caffeine.newBuilder()
                .expireAfterAccess(props.getExpireAfterAccess())
                .maximumSize(props.getMaximumSize())
                .removalListener((String id, SessionContext s, RemovalCause cause) ->
                        log.debug("[session] {} removed ({})", id, cause))
                .build();
        this.scheduler = Schedulers.newBoundedElastic(
                Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE,
                Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE,
                "itguru-session");
    }

    /** Returns the session with this id, creating it (or a fresh id when blank). */
    public SessionContext getOrCreate(String sessionId) {
        String id = StringUtils.hasText(sessionId) ? sessionId : UUID.randomUUID().toString();
        return sessions.get(id, k -> {
            log.debug("[session] created {}", k);
            return new SessionContext(k, scheduler);
        });
    }

    public Optional<SessionContext> find(String sessionId) {
        if (!StringUtils.hasText(sessionId)) return Optional.empty();
        return Optional.ofNullable(sessions.getIfPresent(sessionId));
    }

    public long size() {
        return sessions.estimatedSize();
    }

    @PreDestroy
    public void shutdown() {
        scheduler.dispose();
    }
}
