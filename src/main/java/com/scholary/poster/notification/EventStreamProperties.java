package com.scholary.poster.notification;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for job update fan-out.
 *
 * <p>Maps to the "events.*" keys in application.yml.
 */
@ConfigurationProperties(prefix = "events")
@Validated
public record EventStreamProperties(
    @Positive int subscriberQueueCapacity,
    @Positive long heartbeatSeconds,
    @Positive long emitterTimeoutMinutes,
    @Positive int streamThreads) {}
