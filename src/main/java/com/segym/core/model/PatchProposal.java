package com.segym.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Structured output the model must produce for a single repair step.
 */
public record PatchProposal(
    @JsonPropertyDescription("Path of the file to change, relative to the repository root")
    String filename,
    @JsonPropertyDescription("Exact code to replace, copied verbatim from the file. Empty only when creating a new file")
    String oldCode,
    @JsonPropertyDescription("Code that replaces oldCode")
    String newCode
) {}
