package com.scholary.poster.api;

import com.scholary.poster.theme.ThemeInfo;
import java.util.List;

public record ThemeListResponse(List<ThemeInfo> themes) {}
