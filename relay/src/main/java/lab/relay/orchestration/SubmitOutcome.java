package lab.relay.orchestration;

import java.util.UUID;

public record SubmitOutcome(
        Status status,
        UUID requestId,
        String reason
) {

    public enum Status {
        ACCEPTED,
        RATE_LIMITED,
        INVALID
    }

    public static SubmitOutcome accepted(UUID requestId) {
        return new SubmitOutcome(Status.ACCEPTED, requestId, null);
    }

    public static SubmitOutcome rateLimited(String reason) {
        return new SubmitOutcome(Status.RATE_LIMITED, null, reason);
    }

    public static SubmitOutcome invalid(String reason) {
        return new SubmitOutcome(Status.INVALID, null, reason);
    }

    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }
}
