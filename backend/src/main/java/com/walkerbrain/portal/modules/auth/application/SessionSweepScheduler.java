package com.walkerbrain.portal.modules.auth.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Physically removes sessions that expired without ever being validated again.
 */
@Component
public class SessionSweepScheduler {

    private static final Logger log = LoggerFactory.getLogger(SessionSweepScheduler.class);

    private final SessionService sessionService;

    public SessionSweepScheduler(SessionService sessionService) {
        this.sessionService = sessionService;
    }

    @Scheduled(fixedDelayString = "${app.session.sweep-interval:PT1H}", initialDelayString = "${app.session.sweep-interval:PT1H}")
    public void sweepExpiredSessions() {
        try {
            int removed = sessionService.purgeExpired();
            if (removed > 0) {
                log.info("Removed {} expired sessions", removed);
            }
        } catch (DataAccessException ex) {
            log.warn("[Batch][session-sweep] failed detail={}", ex.getMessage(), ex);
        }
    }
}
