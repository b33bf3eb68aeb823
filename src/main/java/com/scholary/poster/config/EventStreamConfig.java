package com.scholary.poster.config;

import com.scholary.poster.notification.EventStreamProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for job update fan-out.
 *
 * <p>Enables the EventStreamProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(EventStreamProperties.class)
public class EventStreamConfig {}
