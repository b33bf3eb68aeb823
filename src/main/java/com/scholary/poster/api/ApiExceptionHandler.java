package com.scholary.poster.api;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.scholary.poster.gallery.GalleryStoreException;
import com.scholary.poster.theme.ThemeCatalogException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps request failures to the API's error body.
 *
 * <ul>
 *   <li>Bean validation failures: 422 with one {@link ApiError.Violation} per rejected field
 *   <li>Unreadable bodies (bad JSON, unknown size): 400
 *   <li>Unknown job: 404
 *   <li>Theme or gallery storage failures: 500
 * </ul>
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException e) {
    List<ApiError.Violation> violations = new ArrayList<>();
    for (FieldError fieldError : e.getBindingResult().getFieldErrors()) {
      violations.add(
          new ApiError.Violation(
              "validation_error",
              List.of("body", fieldError.getField()),
              fieldError.getField() + ": " + fieldError.getDefaultMessage()));
    }
    LOGGER.debug("Rejected request: {} violation(s)", violations.size());
    return json(HttpStatus.UNPROCESSABLE_ENTITY, ApiError.of(violations));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException e) {
    return json(HttpStatus.BAD_REQUEST, ApiError.of(describe(e)));
  }

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<ApiError> handleJobNotFound(JobNotFoundException e) {
    return json(HttpStatus.NOT_FOUND, ApiError.of("Job not found"));
  }

  @ExceptionHandler(ThemeCatalogException.class)
  public ResponseEntity<ApiError> handleThemeCatalog(ThemeCatalogException e) {
    LOGGER.error("Theme catalog failure", e);
    return json(HttpStatus.INTERNAL_SERVER_ERROR, ApiError.of("Failed to load themes"));
  }

  @ExceptionHandler(GalleryStoreException.class)
  public ResponseEntity<ApiError> handleGallery(GalleryStoreException e) {
    LOGGER.error("Gallery failure", e);
    return json(HttpStatus.INTERNAL_SERVER_ERROR, ApiError.of("Failed to fetch gallery"));
  }

  // Content type is set explicitly so the body is written even for event-stream requests.
  private static ResponseEntity<ApiError> json(HttpStatus status, ApiError body) {
    return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON).body(body);
  }

  private static String describe(HttpMessageNotReadableException e) {
    Throwable cause = e.getCause();
    while (cause != null) {
      if (cause instanceof IllegalArgumentException) {
        return cause.getMessage();
      }
      if (cause.getCause() == null && cause instanceof JsonMappingException mapping) {
        return mapping.getOriginalMessage();
      }
      cause = cause.getCause();
    }
    return "Malformed request body";
  }
}
