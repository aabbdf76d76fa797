package dev.station.model;

/**
 * Operator console output stream a log line is written to.
 */
public enum LogStream {
    OUT("out"),
    ERR("err");

    private final String wireName;

    LogStream(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }

    public static LogStream fromWire(String name) {
        for (LogStream stream : values()) {
            if (stream.wireName.equals(name)) {
                return stream;
            }
        }
        throw new IllegalArgumentException("Unknown log stream: " + name);
    }
}
