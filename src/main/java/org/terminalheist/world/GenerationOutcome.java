package org.terminalheist.world;

import java.util.Objects;

/**
 * What {@link DungeonGenerator#generate(GenerationRequest)} returns: either a result or a failure
 * with a reason. Generation never throws for bad parameters or unlucky seeds.
 */
public final class GenerationOutcome {

    public enum Failure {
        /** Degenerate parameters; no attempt was made. */
        CONFIG_INVALID,
        /** Every attempt up to the cap failed reachability or placement. */
        GENERATION_EXHAUSTED
    }

    private final GenerationResult result;
    private final Failure failure;
    private final String reason;
    private final int attempts;

    private GenerationOutcome(GenerationResult result, Failure failure, String reason, int attempts) {
        this.result = result;
        this.failure = failure;
        this.reason = reason;
        this.attempts = attempts;
    }

    static GenerationOutcome success(GenerationResult result) {
        return new GenerationOutcome(Objects.requireNonNull(result, "result"), null, null, result.attempts());
    }

    static GenerationOutcome failure(Failure failure, String reason, int attempts) {
        return new GenerationOutcome(null, Objects.requireNonNull(failure, "failure"), reason, attempts);
    }

    public boolean isSuccess() {
        return result != null;
    }

    /** @throws IllegalStateException if generation failed */
    public GenerationResult result() {
        if (result == null) throw new IllegalStateException("generation failed: " + failure + " (" + reason + ")");
        return result;
    }

    /** @return the failure kind, or null on success */
    public Failure failure() {
        return failure;
    }

    public String reason() {
        return reason;
    }

    /** Attempts made: 0 for invalid configuration, the cap when exhausted, the winning attempt on success. */
    public int attempts() {
        return attempts;
    }

    @Override
    public String toString() {
        return isSuccess() ? "GenerationOutcome{success, attempts=" + attempts + "}"
                : "GenerationOutcome{" + failure + ", attempts=" + attempts + ", reason=" + reason + "}";
    }
}
