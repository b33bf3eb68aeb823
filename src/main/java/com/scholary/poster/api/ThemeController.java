package com.scholary.poster.api;

import com.scholary.poster.theme.ThemeCatalog;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Themes", description = "Available poster themes")
public class ThemeController {

  private final ThemeCatalog themeCatalog;

  public ThemeController(ThemeCatalog themeCatalog) {
    this.themeCatalog = themeCatalog;
  }

  @GetMapping("/api/themes")
  @Operation(summary = "List themes", description = "All themes the renderer can use")
  public ThemeListResponse list() {
    return new ThemeListResponse(themeCatalog.list());
  }
}
