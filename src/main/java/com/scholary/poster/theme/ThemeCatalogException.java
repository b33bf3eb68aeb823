package com.scholary.poster.theme;

/** Thrown when theme definitions cannot be read. */
public class ThemeCatalogException extends RuntimeException {

  public ThemeCatalogException(String message, Throwable cause) {
    super(message, cause);
  }
}
