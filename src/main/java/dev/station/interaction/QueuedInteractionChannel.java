package dev.station.interaction;

import dev.station.model.LogStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link InteractionChannel} built from two independent flows: an outbound
 * queue of logs and requests that a transport drains, and inbound responses
 * the transport hands back through {@link #deliver}, correlated by request id.
 *
 * <p>One instance serves exactly one run. The engine side calls
 * {@link #sendLog} and {@link #request}; the transport side calls
 * {@link #pollOutbound}, {@link #deliver}, {@link #disconnect} and {@link #fail}.
 */
public final class QueuedInteractionChannel implements InteractionChannel {

    private static final Logger log = LoggerFactory.getLogger(QueuedInteractionChannel.class);

    enum Status { OPEN, DISCONNECTED, FAILED, CLOSED }

    private record Pending(InteractionRequest request, CompletableFuture<Object> reply) {}

    private final BlockingQueue<ConsoleMessage> outbound = new LinkedBlockingQueue<>();
    private final Map<String, Pending> pending = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Object lock = new Object();

    private Status status = Status.OPEN;
    private InteractionTransportException failure;

    // ------------------------------------------------------------------
    // Engine side
    // ------------------------------------------------------------------

    @Override
    public void sendLog(LogStream stream, String text) {
        synchronized (lock) {
            if (status == Status.CLOSED) {
                log.debug("Dropping {} line after close: {}", stream.wireName(), text);
                return;
            }
            outbound.offer(new ConsoleMessage.Log(stream, text));
        }
    }

    @Override
    public InteractionResponse request(InteractionRequest request, Duration timeout) {
        String id = "req-" + sequence.incrementAndGet();
        var reply = new CompletableFuture<Object>();

        synchronized (lock) {
            switch (status) {
                case CLOSED -> throw new InteractionCancelledException("Channel closed; cannot issue " + id);
                case DISCONNECTED -> throw new InteractionCancelledException("Operator disconnected; cannot issue " + id);
                case FAILED -> throw new InteractionTransportException("Console transport failed; cannot issue " + id, failure);
                default -> { }
            }
            // Register before publishing so a fast response always finds its request
            pending.put(id, new Pending(request, reply));
            outbound.offer(new ConsoleMessage.Request(id, request));
        }
        log.debug("Issued {} ({})", id, request.kind().wireName());

        try {
            Object selection = timeout == null
                ? reply.get()
                : reply.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            InteractionResponse response = ResponseValidator.resolve(id, request, selection);
            log.debug("Resolved {} -> {}", id, response);
            return response;
        } catch (TimeoutException e) {
            throw new InteractionTimeoutException(id, timeout);
        } catch (CancellationException e) {
            throw new InteractionCancelledException(cancellationMessage(id), e);
        } catch (ExecutionException e) {
            throw new InteractionTransportException("Console transport failed while waiting for " + id, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InteractionCancelledException("Interrupted while waiting for " + id, e);
        } finally {
            pending.remove(id);
        }
    }

    @Override
    public void close() {
        tearDown(Status.CLOSED, null);
    }

    // ------------------------------------------------------------------
    // Transport side
    // ------------------------------------------------------------------

    /**
     * Take the next outbound message, waiting up to {@code wait}.
     *
     * @return the message, or null if none arrived in time
     */
    public ConsoleMessage pollOutbound(Duration wait) throws InterruptedException {
        return outbound.poll(wait.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Hand an operator response to the request it names.
     *
     * @return false if no request with that id is waiting (never issued,
     *         already answered, timed out, or cancelled)
     */
    public boolean deliver(String requestId, Object selection) {
        Pending p = pending.get(requestId);
        if (p == null) {
            log.warn("Rejecting response to {}: no such pending request", requestId);
            return false;
        }
        return p.reply().complete(selection);
    }

    /**
     * The operator went away. Pending and future requests are cancelled;
     * logs are still queued.
     */
    public void disconnect() {
        tearDown(Status.DISCONNECTED, null);
    }

    /**
     * The transport can no longer carry messages.
     */
    public void fail(Throwable cause) {
        tearDown(Status.FAILED, new InteractionTransportException("Console transport failed", cause));
    }

    /**
     * Whether the transport has nothing left to drain and should stop.
     */
    public boolean drained() {
        synchronized (lock) {
            return status == Status.FAILED || (status == Status.CLOSED && outbound.isEmpty());
        }
    }

    @Override
    public Optional<InteractionTransportException> transportFailure() {
        synchronized (lock) {
            return Optional.ofNullable(failure);
        }
    }

    int pendingCount() {
        return pending.size();
    }

    Status status() {
        synchronized (lock) {
            return status;
        }
    }

    private void tearDown(Status next, InteractionTransportException cause) {
        var torn = new ArrayList<Pending>();
        synchronized (lock) {
            if (status == Status.CLOSED || status == Status.FAILED) {
                return;
            }
            if (status == Status.DISCONNECTED && next == Status.DISCONNECTED) {
                return;
            }
            status = next;
            if (cause != null) {
                failure = cause;
            }
            torn.addAll(pending.values());
        }
        if (!torn.isEmpty()) {
            log.info("Channel {}; unblocking {} pending request(s)", next.name().toLowerCase(), torn.size());
        }
        for (Pending p : torn) {
            if (cause != null) {
                p.reply().completeExceptionally(cause);
            } else {
                p.reply().cancel(false);
            }
        }
    }

    private String cancellationMessage(String id) {
        return switch (status()) {
            case DISCONNECTED -> "Operator disconnected while " + id + " was pending";
            default -> "Channel closed while " + id + " was pending";
        };
    }
}
