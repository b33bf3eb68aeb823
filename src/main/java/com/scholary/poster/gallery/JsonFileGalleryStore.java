package com.scholary.poster.gallery;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.scholary.poster.api.PosterRequest;
import com.scholary.poster.theme.ThemeInfo;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gallery persisted as a single JSON document.
 *
 * <p>Format:
 *
 * <pre>
 * {
 *   "entries": [
 *     {"jobId": "...", "city": "Paris", "country": "France", "theme": "noir", ...}
 *   ]
 * }
 * </pre>
 *
 * <p>All access is serialized on this instance; the file is rewritten through a temporary file and
 * a move so readers never see a half-written document.
 */
public class JsonFileGalleryStore implements GalleryStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(JsonFileGalleryStore.class);

  static final String DEFAULT_BG_COLOR = "#0a0a0a";
  static final String DEFAULT_TEXT_COLOR = "#f5f0e8";

  private final ObjectMapper objectMapper;
  private final Path file;
  private final int maxEntries;

  public JsonFileGalleryStore(ObjectMapper objectMapper, Path file, int maxEntries) {
    this.objectMapper =
        objectMapper
            .copy()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    this.file = file;
    this.maxEntries = maxEntries;
  }

  @Override
  public synchronized GalleryEntry add(String jobId, PosterRequest request, ThemeInfo theme) {
    GalleryEntry entry =
        new GalleryEntry(
            jobId,
            request.city(),
            request.state(),
            request.country(),
            request.theme(),
            theme != null ? theme.name() : request.theme(),
            theme != null && theme.bg() != null ? theme.bg() : DEFAULT_BG_COLOR,
            theme != null && theme.text() != null ? theme.text() : DEFAULT_TEXT_COLOR,
            Instant.now());

    List<GalleryEntry> entries = new ArrayList<>(load());
    entries.removeIf(existing -> existing.jobId().equals(jobId));
    entries.add(0, entry);
    if (entries.size() > maxEntries) {
      entries = new ArrayList<>(entries.subList(0, maxEntries));
    }
    save(entries);

    LOGGER.info(
        "Added poster {} to gallery: {}, {} ({} entries)",
        jobId,
        request.city(),
        request.country(),
        entries.size());
    return entry;
  }

  @Override
  public synchronized List<GalleryEntry> getRecent(int limit) {
    List<GalleryEntry> entries = load();
    int count = Math.max(0, Math.min(limit, entries.size()));
    return List.copyOf(entries.subList(0, count));
  }

  @Override
  public synchronized int size() {
    return load().size();
  }

  @Override
  public synchronized Optional<GalleryEntry> find(String jobId) {
    return load().stream().filter(entry -> entry.jobId().equals(jobId)).findFirst();
  }

  @Override
  public synchronized boolean remove(String jobId) {
    List<GalleryEntry> entries = new ArrayList<>(load());
    boolean removed = entries.removeIf(entry -> entry.jobId().equals(jobId));
    if (removed) {
      save(entries);
      LOGGER.info("Removed poster {} from gallery", jobId);
    }
    return removed;
  }

  private List<GalleryEntry> load() {
    if (!Files.exists(file)) {
      return List.of();
    }
    try {
      GalleryDocument document = objectMapper.readValue(file.toFile(), GalleryDocument.class);
      return document.entries() != null ? document.entries() : List.of();
    } catch (IOException e) {
      // Treated as empty; the next add rewrites the file.
      LOGGER.error("Failed to load gallery from {}: {}", file, e.getMessage());
      return List.of();
    }
  }

  private void save(List<GalleryEntry> entries) {
    try {
      Path parent = file.toAbsolutePath().getParent();
      Files.createDirectories(parent);
      Path temp = Files.createTempFile(parent, "gallery", ".tmp");
      objectMapper
          .writerWithDefaultPrettyPrinter()
          .writeValue(temp.toFile(), new GalleryDocument(entries));
      try {
        Files.move(
            temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      throw new GalleryStoreException("Failed to save gallery to " + file, e);
    }
  }

  public record GalleryDocument(List<GalleryEntry> entries) {}
}
