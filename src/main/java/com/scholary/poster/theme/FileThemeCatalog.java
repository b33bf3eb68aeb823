package com.scholary.poster.theme;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.poster.config.PosterStorageProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads theme definitions from the {@code *.json} files in the themes directory.
 *
 * <p>Files are read on every call; there are only a handful of them and this way edits show up
 * without a restart.
 */
@Component
public class FileThemeCatalog implements ThemeCatalog {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileThemeCatalog.class);

  private static final String EXTENSION = ".json";
  private static final Pattern VALID_ID = Pattern.compile("[A-Za-z0-9_-]+");

  private final ObjectMapper objectMapper;
  private final Path themesDir;

  public FileThemeCatalog(ObjectMapper objectMapper, PosterStorageProperties properties) {
    this.objectMapper = objectMapper;
    this.themesDir = properties.themesPath();
  }

  @Override
  public List<ThemeInfo> list() {
    if (!Files.isDirectory(themesDir)) {
      LOGGER.warn("Themes directory does not exist: {}", themesDir);
      return List.of();
    }

    List<ThemeInfo> themes = new ArrayList<>();
    try (Stream<Path> files = Files.list(themesDir)) {
      List<Path> themeFiles =
          files
              .filter(file -> file.getFileName().toString().endsWith(EXTENSION))
              .sorted()
              .toList();
      for (Path file : themeFiles) {
        themes.add(read(file));
      }
    } catch (IOException e) {
      throw new ThemeCatalogException("Failed to list themes in " + themesDir, e);
    }
    return themes;
  }

  @Override
  public Optional<ThemeInfo> find(String themeId) {
    // Theme IDs become file names, so anything path-like is rejected outright.
    if (themeId == null || !VALID_ID.matcher(themeId).matches()) {
      return Optional.empty();
    }
    Path file = themesDir.resolve(themeId + EXTENSION);
    if (!Files.isRegularFile(file)) {
      return Optional.empty();
    }
    return Optional.of(read(file));
  }

  private ThemeInfo read(Path file) {
    String fileName = file.getFileName().toString();
    String id = fileName.substring(0, fileName.length() - EXTENSION.length());
    try {
      JsonNode data = objectMapper.readTree(file.toFile());
      return new ThemeInfo(
          id,
          text(data, "name", id),
          text(data, "description", null),
          text(data, "bg", "#FFFFFF"),
          text(data, "text", "#000000"));
    } catch (IOException e) {
      throw new ThemeCatalogException("Failed to read theme " + file, e);
    }
  }

  private static String text(JsonNode data, String field, String fallback) {
    JsonNode value = data.get(field);
    return value != null && value.isTextual() && !value.asText().isBlank()
        ? value.asText()
        : fallback;
  }
}
