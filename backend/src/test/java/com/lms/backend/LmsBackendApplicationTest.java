package com.lms.backend;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.env.MapPropertySource;
import org.springframework.core.env.SimpleCommandLinePropertySource;
import org.springframework.core.env.StandardEnvironment;

class LmsBackendApplicationTest {

    @Test
    @DisplayName("a command switches the scheduler off even when configuration enables it")
    void launchArgs_commandDisablesScheduler() {
        String[] launch = LmsBackendApplication.launchArgs(new String[] {"run"});

        assertThat(launch).containsExactly("run", LmsBackendApplication.SCHEDULER_OFF);
        assertThat(resolve(launch)).isEqualTo("false");
    }

    @Test
    void launchArgs_daemonKeepsArguments() {
        String[] args = {"--spring.profiles.active=prod"};

        assertThat(LmsBackendApplication.launchArgs(args)).isSameAs(args);
        assertThat(LmsBackendApplication.isCommandMode(args)).isFalse();
        assertThat(resolve(args)).isEqualTo("true");
    }

    private static String resolve(String[] launch) {
        StandardEnvironment environment = new StandardEnvironment();
        environment.getPropertySources().addLast(new MapPropertySource("application.yml",
                Map.of("lms.inactivity.scheduler.enabled", "true")));
        environment.getPropertySources().addFirst(new SimpleCommandLinePropertySource(launch));
        return environment.getProperty("lms.inactivity.scheduler.enabled");
    }
}
