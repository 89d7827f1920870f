package lab.relay.event;

public enum RelayEventKind {
    TRANSFER_INITIATED(false),
    TRANSFER_COMPLETED(true),
    TRANSFER_FAILED(true),
    GENERIC_MESSAGE(true);

    private final boolean requiresAuthorization;

    RelayEventKind(boolean requiresAuthorization) {
        this.requiresAuthorization = requiresAuthorization;
    }

    // Kinds whose payload triggers local state changes must carry an authorized signature.
    public boolean requiresAuthorization() {
        return requiresAuthorization;
    }
}
