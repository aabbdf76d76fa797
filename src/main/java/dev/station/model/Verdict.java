package dev.station.model;

public enum Verdict {
    PASSED,
    FAILED
}
