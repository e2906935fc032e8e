package io.ucmsdk.core.testkit;

import io.ucmsdk.core.spi.TelemetryListener;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Collects facade telemetry events for assertions. */
public final class RecordingTelemetryListener implements TelemetryListener {

    public final List<CallStartedEvent> started = new CopyOnWriteArrayList<>();
    public final List<CallCompletedEvent> completed = new CopyOnWriteArrayList<>();
    public final List<CallFailedEvent> failed = new CopyOnWriteArrayList<>();

    @Override
    public void onCallStarted(CallStartedEvent event) {
        started.add(event);
    }

    @Override
    public void onCallCompleted(CallCompletedEvent event) {
        completed.add(event);
    }

    @Override
    public void onCallFailed(CallFailedEvent event) {
        failed.add(event);
    }
}
