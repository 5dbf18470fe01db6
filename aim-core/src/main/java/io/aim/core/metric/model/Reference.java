package io.aim.core.metric.model;

/// Bibliographic reference shown alongside a metric.
///
/// @param title citation text, not null
/// @param fileName name of the attached document, may be null
public record Reference(String title, String fileName) {}
