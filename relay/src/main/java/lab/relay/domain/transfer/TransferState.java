package lab.relay.domain.transfer;

import java.util.EnumSet;
import java.util.Set;

public enum TransferState {
    PENDING,
    SUBMITTING,
    AWAITING_CONFIRMATION,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(TransferState next) {
        return allowedNext().contains(next);
    }

    private Set<TransferState> allowedNext() {
        return switch (this) {
            case PENDING -> EnumSet.of(SUBMITTING, CANCELLED);
            case SUBMITTING -> EnumSet.of(AWAITING_CONFIRMATION, FAILED);
            case AWAITING_CONFIRMATION -> EnumSet.of(COMPLETED, FAILED);
            case COMPLETED, FAILED, CANCELLED -> EnumSet.noneOf(TransferState.class);
        };
    }
}
