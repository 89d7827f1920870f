package lab.relay.event;

public record InboundEventRequest(
        String sourceChain,
        String txId,
        Long logIndex,
        RelayEventKind kind,
        String payloadHex,
        String signatureHex
) {}
