package io.ucmsdk.core.spi;

import io.ucmsdk.core.model.Backend;

/**
 * SPI for observability hooks around facade calls.
 *
 * <p>
 * Integrators bridge these events to their metrics or tracing system; the core
 * has no telemetry dependency. Implementations must be thread-safe and
 * non-blocking. Exceptions thrown by a listener are caught and logged by the
 * facade and never affect the call.
 */
public interface TelemetryListener {

    /**
     * Called before arguments are verified.
     *
     * @param event backend, operation and version
     */
    void onCallStarted(CallStartedEvent event);

    /**
     * Called after the response has been normalized.
     *
     * @param event backend, operation, version and duration
     */
    void onCallCompleted(CallCompletedEvent event);

    /**
     * Called when any phase of the call fails.
     *
     * @param event backend, operation, version, duration, failing phase and
     *              detail
     */
    void onCallFailed(CallFailedEvent event);

    // --- Event records ---

    /** Event emitted when a call starts. */
    record CallStartedEvent(Backend backend, String operation, String apiVersion) {}

    /** Event emitted when a call completes successfully. */
    record CallCompletedEvent(Backend backend, String operation, String apiVersion, long durationMs) {}

    /**
     * Event emitted when a call fails. {@code phase} is the failing exception's
     * phase name, or {@code INTERNAL} for an unexpected runtime failure.
     */
    record CallFailedEvent(
            Backend backend, String operation, String apiVersion, long durationMs, String phase, String errorDetail) {}
}
