package com.scholary.poster.api;

import com.scholary.poster.config.PosterStorageProperties;
import com.scholary.poster.gallery.GalleryProperties;
import com.scholary.poster.gallery.GalleryStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Public gallery of recently rendered posters. */
@RestController
@RequestMapping("/api/gallery")
@Tag(name = "Gallery", description = "Recently generated posters")
public class GalleryController {

  private final GalleryStore galleryStore;
  private final GalleryProperties galleryProperties;
  private final PosterStorageProperties storageProperties;

  public GalleryController(
      GalleryStore galleryStore,
      GalleryProperties galleryProperties,
      PosterStorageProperties storageProperties) {
    this.galleryStore = galleryStore;
    this.galleryProperties = galleryProperties;
    this.storageProperties = storageProperties;
  }

  @GetMapping
  @Operation(summary = "List gallery", description = "Most recent gallery posters, newest first")
  public GalleryResponse list(@RequestParam(required = false) Integer limit) {
    int max = galleryProperties.maxEntries();
    int effective = limit == null || limit <= 0 ? max : Math.min(limit, max);
    return new GalleryResponse(galleryStore.getRecent(effective), galleryStore.size());
  }

  @GetMapping("/image/{jobId}")
  @Operation(summary = "Gallery image", description = "PNG of a poster listed in the gallery")
  public ResponseEntity<?> image(@PathVariable String jobId) {
    if (galleryStore.find(jobId).isEmpty()) {
      return ResponseEntity.status(HttpStatus.NOT_FOUND)
          .body(ApiError.of("Poster not found in gallery"));
    }

    Path file = storageProperties.posterFile(jobId);
    if (!Files.exists(file)) {
      return ResponseEntity.status(HttpStatus.NOT_FOUND)
          .body(ApiError.of("Poster file not found"));
    }

    return ResponseEntity.ok()
        .contentType(MediaType.IMAGE_PNG)
        .cacheControl(CacheControl.maxAge(Duration.ofDays(1)).cachePublic())
        .body(new FileSystemResource(file));
  }
}
