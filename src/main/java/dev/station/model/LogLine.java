package dev.station.model;

import java.time.Instant;

/**
 * One line of step output, captured in the step's execution record.
 */
public record LogLine(LogStream stream, String text, Instant at) {}
