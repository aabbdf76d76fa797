package dev.station.interaction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Reference operator console transport: JSON lines over a pair of byte streams.
 *
 * <p>A writer thread drains the channel's outbound queue; a reader thread
 * decodes responses and delivers them to the channel. End of input is an
 * operator disconnect; an I/O error on either stream fails the channel.
 *
 * <p>This class does not close the streams it was given.
 */
public final class JsonLinesConsole implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesConsole.class);
    private static final Duration POLL_INTERVAL = Duration.ofMillis(50);
    private static final long SHUTDOWN_WAIT_MILLIS = 2_000;

    private final QueuedInteractionChannel channel;
    private final BufferedReader in;
    private final Writer out;
    private final ExecutorService workers;

    public JsonLinesConsole(QueuedInteractionChannel channel, InputStream in, OutputStream out) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
        this.workers = Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "console-io");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        workers.submit(this::pumpOutbound);
        workers.submit(this::pumpInbound);
    }

    /**
     * Close the channel, flush queued output, and stop both pumps.
     */
    @Override
    public void close() {
        channel.close();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(SHUTDOWN_WAIT_MILLIS, TimeUnit.MILLISECONDS)) {
                // The reader may be parked in a blocking read
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    private void pumpOutbound() {
        try {
            while (!channel.drained()) {
                ConsoleMessage message = channel.pollOutbound(POLL_INTERVAL);
                if (message == null) {
                    continue;
                }
                out.write(ConsoleCodec.encode(message));
                out.write('\n');
                out.flush();
            }
        } catch (IOException e) {
            log.error("Console write failed", e);
            channel.fail(e);
        } catch (RuntimeException e) {
            log.error("Cannot encode outbound console message", e);
            channel.fail(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void pumpInbound() {
        try {
            String line;
            while ((line = in.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                accept(line);
            }
            log.info("Operator console input closed");
            channel.disconnect();
        } catch (IOException e) {
            log.error("Console read failed", e);
            channel.fail(e);
        }
    }

    private void accept(String line) {
        ConsoleMessage message;
        try {
            message = ConsoleCodec.decode(line);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring malformed console line: {} ({})", line, e.getMessage());
            return;
        }
        if (message instanceof ConsoleMessage.Response r) {
            channel.deliver(r.id(), r.selection());
        } else {
            log.warn("Ignoring unexpected inbound console message: {}", message);
        }
    }
}
