package dev.station.interaction;

import dev.station.model.LogStream;

import java.time.Duration;
import java.util.Optional;

/**
 * Bidirectional link between a running step and the operator console.
 *
 * <p>{@link #sendLog} never blocks. {@link #request} is the only place a run
 * suspends: it blocks the calling worker until the correlated response
 * arrives, the channel is torn down, or the timeout elapses.
 */
public interface InteractionChannel extends AutoCloseable {

    /**
     * Queue a line of output for the console. Lines on one stream keep call order.
     */
    void sendLog(LogStream stream, String text);

    /**
     * Issue a prompt and wait for the operator's answer.
     *
     * @param request the prompt
     * @param timeout maximum wait, or null to wait indefinitely
     * @return the validated response
     * @throws ResponseValidationException   if the answer does not fit the request
     * @throws InteractionCancelledException if the channel closes or the operator disconnects first
     * @throws InteractionTimeoutException   if the timeout elapses first
     * @throws InteractionTransportException if the transport has failed
     */
    InteractionResponse request(InteractionRequest request, Duration timeout);

    default InteractionResponse request(InteractionRequest request) {
        return request(request, null);
    }

    /**
     * A transport failure that happened outside any request, e.g. while
     * delivering a log line. Empty while the transport is healthy.
     */
    default Optional<InteractionTransportException> transportFailure() {
        return Optional.empty();
    }

    /**
     * Tear the channel down. Pending requests are cancelled.
     */
    @Override
    void close();
}
