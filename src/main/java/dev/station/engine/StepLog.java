package dev.station.engine;

import dev.station.interaction.InteractionChannel;
import dev.station.model.LogLine;
import dev.station.model.LogStream;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Output sink bound to one step execution. Every line is kept for the
 * execution record and forwarded to the operator console.
 */
public final class StepLog {
    private final InteractionChannel channel;
    private final Clock clock;
    private final List<LogLine> lines = new ArrayList<>();

    StepLog(InteractionChannel channel, Clock clock) {
        this.channel = channel;
        this.clock = clock;
    }

    public void out(String text) {
        write(LogStream.OUT, text);
    }

    public void err(String text) {
        write(LogStream.ERR, text);
    }

    public void write(LogStream stream, String text) {
        String line = String.valueOf(text);
        lines.add(new LogLine(stream, line, clock.instant()));
        channel.sendLog(stream, line);
    }

    public List<LogLine> lines() {
        return List.copyOf(lines);
    }
}
