package com.purchasingpower.signalintel.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the standalone {@code @ConfigurationProperties} classes that are not
 * nested under {@link com.purchasingpower.signalintel.configuration.AppProperties}.
 *
 * <ul>
 *   <li>{@link GlobalRetryConfig} - retry and backoff for provider calls
 *   <li>{@link HttpClientConfig.HttpTimeouts} - provider transport timeouts
 *   <li>{@link ExecutorConfig.ExecutorProperties} - pipeline thread pool sizing
 * </ul>
 *
 * @since 1.0.0
 */
@Configuration
@EnableConfigurationProperties({
    GlobalRetryConfig.class,
    HttpClientConfig.HttpTimeouts.class,
    ExecutorConfig.ExecutorProperties.class
})
public class ConfigurationPropertiesEnablerConfig {
}
