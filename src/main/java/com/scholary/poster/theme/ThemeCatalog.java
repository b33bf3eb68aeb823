package com.scholary.poster.theme;

import java.util.List;
import java.util.Optional;

/**
 * Lookup of the themes the renderer knows about.
 *
 * <p>Used for request validation and to decorate gallery entries. It never changes how a poster is
 * rendered; the renderer reads the theme files itself.
 */
public interface ThemeCatalog {

  /** All themes, sorted by ID. */
  List<ThemeInfo> list();

  /** The theme with the given ID, if it exists. */
  Optional<ThemeInfo> find(String themeId);

  default boolean exists(String themeId) {
    return find(themeId).isPresent();
  }
}
