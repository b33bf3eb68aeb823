package com.scholary.poster.render;

/**
 * Progress hint extracted from one line of renderer output.
 *
 * @param progress percent complete (0-100)
 * @param message human-readable status, or {@code null} to keep the current message
 */
public record ProgressSignal(int progress, String message) {}
