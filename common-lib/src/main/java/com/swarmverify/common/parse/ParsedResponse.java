package com.swarmverify.common.parse;

import com.swarmverify.common.model.Outcome;

import java.util.List;

/** Structured fields recovered from free-form agent text. Never contains {@code null}. */
public record ParsedResponse(
    Outcome outcome,
    int confidence,
    String rationale,
    List<String> sources
) {}
