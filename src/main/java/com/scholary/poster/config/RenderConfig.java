package com.scholary.poster.config;

import com.scholary.poster.render.RenderProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for renderer-related beans.
 *
 * <p>Enables the RenderProperties and PosterStorageProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties({RenderProperties.class, PosterStorageProperties.class})
public class RenderConfig {}
