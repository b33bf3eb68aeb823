package com.scholary.poster.gallery;

import java.time.Instant;

/** A poster listed in the public gallery. */
public record GalleryEntry(
    String jobId,
    String city,
    String state,
    String country,
    String theme,
    String themeName,
    String bgColor,
    String textColor,
    Instant createdAt) {}
