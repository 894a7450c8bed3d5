package com.lms.backend.global.common.time;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.auditing.DateTimeProvider;

/**
 * Single UTC time source. Scan cycles, audit entries, report names and entity timestamps all read from
 * the same {@link Clock}.
 */
@Configuration
public class TimeConfig {

    public static final String AUDITING_TIME_PROVIDER = "utcOffsetDateTimeProvider";

    @Bean
    public Clock utcClock() {
        return Clock.system(ZoneOffset.UTC);
    }

    @Bean(name = AUDITING_TIME_PROVIDER)
    public DateTimeProvider utcOffsetDateTimeProvider(Clock clock) {
        return () -> Optional.of(OffsetDateTime.now(clock));
    }
}
