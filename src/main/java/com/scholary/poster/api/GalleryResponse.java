package com.scholary.poster.api;

import com.scholary.poster.gallery.GalleryEntry;
import java.util.List;

/** Recent gallery posters plus the total number stored. */
public record GalleryResponse(List<GalleryEntry> posters, int total) {}
