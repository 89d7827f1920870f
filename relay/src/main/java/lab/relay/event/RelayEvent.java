package lab.relay.event;

import java.time.Instant;

/**
 * Deduplicated, authenticated event handed to handlers. {@code signer} is null for kinds that need no authorization.
 */
public record RelayEvent(
        String eventId,
        RelayEventKind kind,
        byte[] payload,
        String sourceChain,
        String txId,
        Instant observedAt,
        String signer
) {
    public RelayEvent {
        payload = payload == null ? new byte[0] : payload.clone();
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }
}
