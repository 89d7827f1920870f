package lab.relay.event;

/**
 * Event as delivered by an event source, before deduplication and authentication.
 */
public record RawChainEvent(
        String sourceChain,
        String txId,
        long logIndex,
        RelayEventKind kind,
        byte[] payload,
        byte[] signature
) {
    public RawChainEvent {
        if (sourceChain == null || sourceChain.isBlank()) {
            throw new IllegalArgumentException("sourceChain is required");
        }
        if (txId == null || txId.isBlank()) {
            throw new IllegalArgumentException("txId is required");
        }
        if (logIndex < 0) {
            throw new IllegalArgumentException("logIndex must be >= 0");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
        payload = payload == null ? new byte[0] : payload.clone();
        signature = signature == null ? null : signature.clone();
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    @Override
    public byte[] signature() {
        return signature == null ? null : signature.clone();
    }

    public String eventId() {
        return EventIds.of(sourceChain, txId, logIndex);
    }
}
