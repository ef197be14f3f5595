package com.williamcallahan.viewmarkup.web;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Request body for tree inspection.
 *
 * @param markup view markup to parse
 * @param order optional 1-based range order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ViewTreeRequest(String markup, List<Integer> order) {}
