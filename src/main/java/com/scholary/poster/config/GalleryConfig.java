package com.scholary.poster.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.poster.gallery.GalleryProperties;
import com.scholary.poster.gallery.GalleryStore;
import com.scholary.poster.gallery.JsonFileGalleryStore;
import java.nio.file.Paths;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the public gallery.
 *
 * <p>Wires up the GalleryStore bean using properties from application.yml.
 */
@Configuration
@EnableConfigurationProperties(GalleryProperties.class)
public class GalleryConfig {

  @Bean
  public GalleryStore galleryStore(ObjectMapper objectMapper, GalleryProperties properties) {
    return new JsonFileGalleryStore(
        objectMapper, Paths.get(properties.file()), properties.maxEntries());
  }
}
