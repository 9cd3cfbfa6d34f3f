package com.pinclick.copilot.service;

import com.pinclick.copilot.model.RequirementExtraction;

import java.util.Optional;

/**
 * Pulls the search fields a message states explicitly. Absent fields stay null or empty.
 */
public interface RequirementExtractor {

    Optional<RequirementExtraction> extract(String message);
}
