package com.scholary.poster.gallery;

import com.scholary.poster.api.PosterRequest;
import com.scholary.poster.theme.ThemeInfo;
import java.util.List;
import java.util.Optional;

/**
 * Bounded, newest-first list of publicly listed posters.
 *
 * <p>Entries are added once per completed job that opted in. The list is trimmed to a fixed
 * maximum on every insert.
 */
public interface GalleryStore {

  /**
   * Add a completed poster to the front of the gallery.
   *
   * @param jobId the completed job
   * @param request the job's request
   * @param theme display metadata of the request's theme, or {@code null} if unknown
   * @return the stored entry
   * @throws GalleryStoreException if the gallery cannot be persisted
   */
  GalleryEntry add(String jobId, PosterRequest request, ThemeInfo theme);

  /** Up to {@code limit} most recent entries, newest first. */
  List<GalleryEntry> getRecent(int limit);

  /** Total number of stored entries. */
  int size();

  Optional<GalleryEntry> find(String jobId);

  /** @return true if an entry was removed */
  boolean remove(String jobId);
}
