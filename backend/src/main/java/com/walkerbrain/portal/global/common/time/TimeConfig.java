package com.walkerbrain.portal.global.common.time;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * The portal's only clock: session expiry, cache TTLs and dashboard windows all read it. Setting
 * {@code app.clock.fixed-instant} pins it, which demo environments use to replay a fixed day of calls.
 */
@Configuration
public class TimeConfig {

    private static final Logger log = LoggerFactory.getLogger(TimeConfig.class);

    @Bean
    public Clock portalClock(@Value("${app.clock.fixed-instant:}") String fixedInstant) {
        return clockFor(fixedInstant);
    }

    static Clock clockFor(String fixedInstant) {
        if (!StringUtils.hasText(fixedInstant)) {
            return Clock.system(ZoneOffset.UTC);
        }
        Instant pinned = Instant.parse(fixedInstant.trim());
        log.warn("Portal clock pinned to {}; sessions and cache entries will not age", pinned);
        return Clock.fixed(pinned, ZoneOffset.UTC);
    }
}
