package io.ucmsdk.tools.probe;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of {@link ServerProbe#diagnose()}: one entry per step, in the order
 * they ran. Steps after a failed server check are reported as skipped.
 *
 * @param steps the step outcomes
 */
public record ProbeReport(List<Step> steps) {

    public ProbeReport {
        steps = List.copyOf(steps);
    }

    /** Status of one step. */
    public enum Status {
        OK,
        FAILED,
        SKIPPED
    }

    /**
     * @param name   step name ({@code server}, {@code axl-auth}, {@code version})
     * @param status outcome
     * @param detail human-readable detail, e.g. the detected version or the
     *               failure message
     * @param kind   failure kind, {@code null} unless {@code FAILED}
     */
    public record Step(String name, Status status, String detail, ProbeException.Kind kind) {

        static Step ok(String name, String detail) {
            return new Step(name, Status.OK, detail, null);
        }

        static Step failed(String name, ProbeException e) {
            return new Step(name, Status.FAILED, e.getMessage(), e.kind());
        }

        static Step skipped(String name, String reason) {
            return new Step(name, Status.SKIPPED, reason, null);
        }
    }

    /** {@code true} if every step succeeded. */
    public boolean isHealthy() {
        return steps.stream().allMatch(step -> step.status() == Status.OK);
    }

    public Optional<Step> step(String name) {
        return steps.stream().filter(step -> step.name().equals(name)).findFirst();
    }

    /** The detected API version, if the version step succeeded. */
    public Optional<String> detectedVersion() {
        return step(ServerProbe.STEP_VERSION)
                .filter(step -> step.status() == Status.OK)
                .map(Step::detail);
    }
}
