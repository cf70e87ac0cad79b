package com.folio.backend.model;

/**
 * Whether a benchmark-relative metric was actually computed or fell back to
 * its neutral value because its inputs could not be obtained.
 */
public enum MetricStatus {
    COMPUTED,
    UNAVAILABLE
}
