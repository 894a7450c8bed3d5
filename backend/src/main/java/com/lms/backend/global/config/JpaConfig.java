package com.lms.backend.global.config;

import com.lms.backend.global.common.time.TimeConfig;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

@Configuration
@EnableTransactionManagement
@EnableJpaRepositories(basePackages = "com.lms.backend.modules")
@EnableJpaAuditing(dateTimeProviderRef = TimeConfig.AUDITING_TIME_PROVIDER)
public class JpaConfig {
}
