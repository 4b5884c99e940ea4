package com.ai.eligibility.config;

import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Repository and entity scanning. Web-only test slices do not load this class.
 */
@Configuration
@EnableJpaRepositories(basePackages = "com.ai.eligibility.repository")
@EntityScan(basePackages = "com.ai.eligibility.entity")
public class JpaConfig {
}
