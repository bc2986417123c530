package com.portray.portal.features.auth.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Reclaims session rows that expired without ever being read again.
 */
@Component
public class ExpiredSessionPurger {

    private static final Logger log = LoggerFactory.getLogger(ExpiredSessionPurger.class);

    private final SessionService sessionService;

    public ExpiredSessionPurger(SessionService sessionService) {
        this.sessionService = sessionService;
    }

    @Scheduled(fixedDelayString = "${app.portal.session.purge-interval-ms:3600000}")
    public void purge() {
        try {
            int removed = sessionService.purgeExpired();
            if (removed > 0) {
                log.info("Purged {} expired session(s)", removed);
            }
        } catch (Exception e) {
            log.error("Expired session purge failed", e);
        }
    }
}
