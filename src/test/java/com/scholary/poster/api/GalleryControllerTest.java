package com.scholary.poster.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.poster.config.PosterStorageProperties;
import com.scholary.poster.gallery.GalleryEntry;
import com.scholary.poster.gallery.GalleryProperties;
import com.scholary.poster.gallery.GalleryStore;
import com.scholary.poster.theme.ThemeCatalog;
import com.scholary.poster.theme.ThemeInfo;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/** Tests for the gallery, theme and health endpoints. */
@ExtendWith(MockitoExtension.class)
class GalleryControllerTest {

  private static final GalleryEntry ENTRY =
      new GalleryEntry(
          "job-1", "Paris", null, "France", "noir", "Noir", "#000000", "#FFFFFF", Instant.now());

  @Mock private GalleryStore galleryStore;
  @Mock private ThemeCatalog themeCatalog;

  @TempDir Path tempDir;

  private PosterStorageProperties storageProperties;
  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    storageProperties = new PosterStorageProperties(tempDir.toString(), tempDir.toString());
    mockMvc =
        MockMvcBuilders.standaloneSetup(
                new GalleryController(
                    galleryStore, new GalleryProperties("unused.json", 12), storageProperties),
                new ThemeController(themeCatalog),
                new HealthController())
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
  }

  @Test
  void list_shouldCapLimitAtMaxEntries() throws Exception {
    when(galleryStore.getRecent(12)).thenReturn(List.of(ENTRY));
    when(galleryStore.size()).thenReturn(1);

    mockMvc
        .perform(get("/api/gallery").param("limit", "50"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total").value(1))
        .andExpect(jsonPath("$.posters[0].jobId").value("job-1"))
        .andExpect(jsonPath("$.posters[0].themeName").value("Noir"));
  }

  @Test
  void list_shouldHonourSmallerLimit() throws Exception {
    when(galleryStore.getRecent(3)).thenReturn(List.of());
    when(galleryStore.size()).thenReturn(0);

    mockMvc
        .perform(get("/api/gallery").param("limit", "3"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.posters").isEmpty());
  }

  @Test
  void image_shouldReturn404WhenNotInGallery() throws Exception {
    when(galleryStore.find("job-9")).thenReturn(Optional.empty());

    mockMvc
        .perform(get("/api/gallery/image/job-9"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.detail").value("Poster not found in gallery"));
  }

  @Test
  void image_shouldServeCacheablePng() throws Exception {
    when(galleryStore.find("job-1")).thenReturn(Optional.of(ENTRY));
    Files.write(storageProperties.posterFile("job-1"), new byte[] {1, 2, 3});

    mockMvc
        .perform(get("/api/gallery/image/job-1"))
        .andExpect(status().isOk())
        .andExpect(content().contentType(MediaType.IMAGE_PNG))
        .andExpect(header().string("Cache-Control", "max-age=86400, public"));
  }

  @Test
  void themes_shouldListCatalog() throws Exception {
    when(themeCatalog.list())
        .thenReturn(List.of(new ThemeInfo("noir", "Noir", "Dark", "#000000", "#FFFFFF")));

    mockMvc
        .perform(get("/api/themes"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.themes[0].id").value("noir"))
        .andExpect(jsonPath("$.themes[0].bg").value("#000000"));
  }

  @Test
  void health_shouldReportOk() throws Exception {
    mockMvc
        .perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("ok"));
  }
}
