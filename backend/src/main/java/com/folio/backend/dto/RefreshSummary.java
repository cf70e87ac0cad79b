package com.folio.backend.dto;

import java.util.List;

public record RefreshSummary(int requested, List<String> refreshed, List<String> failed) {}
