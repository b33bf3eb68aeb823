package com.scholary.poster.gallery;

/** Exception thrown when the gallery file cannot be read or written. */
public class GalleryStoreException extends RuntimeException {

  public GalleryStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
