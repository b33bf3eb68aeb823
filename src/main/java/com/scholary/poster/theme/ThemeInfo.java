package com.scholary.poster.theme;

/**
 * Display metadata of a poster theme.
 *
 * @param id theme identifier (file name without extension)
 * @param name display name
 * @param description optional description
 * @param bg background color
 * @param text text color
 */
public record ThemeInfo(String id, String name, String description, String bg, String text) {}
