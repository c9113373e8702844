package com.phillippitts.scribedesk.config.session;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Session infrastructure beans.
 */
@Configuration
public class SessionConfig {

    /**
     * Wall clock used to anchor runs, time speaker switches and stamp exports. Replaced by a
     * fixed or mutable clock in tests.
     */
    @Bean
    public Clock clock(SessionProperties properties) {
        return Clock.system(properties.zoneId());
    }
}
