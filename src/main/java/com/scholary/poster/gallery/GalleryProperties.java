package com.scholary.poster.gallery;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the public gallery.
 *
 * <p>Maps to the "gallery.*" keys in application.yml.
 */
@ConfigurationProperties(prefix = "gallery")
@Validated
public record GalleryProperties(@NotBlank String file, @Positive int maxEntries) {}
