package com.williamcallahan.viewmarkup.web;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Request body for markup normalization. Absent display flags fall back to the configured defaults.
 *
 * @param markup view markup to parse
 * @param order optional 1-based range order
 * @param lastRangeBackward whether the last range is backward
 * @param showType write element types
 * @param showPriority write attribute priorities
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NormalizeMarkupRequest(
    String markup,
    List<Integer> order,
    Boolean lastRangeBackward,
    Boolean showType,
    Boolean showPriority
) {}
