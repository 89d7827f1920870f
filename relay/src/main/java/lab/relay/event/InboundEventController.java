package lab.relay.event;

import lab.relay.orchestration.InvalidRequestException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.web3j.utils.Numeric;

@RestController
@RequiredArgsConstructor
@RequestMapping("/relay/events")
@Slf4j
public class InboundEventController {

    private final RelayEventDispatcher dispatcher;

    // Webhook for relayers that push events instead of the node log stream. Dispatch runs on the request thread.
    @PostMapping
    public ResponseEntity<InboundEventResponse> receive(@RequestBody InboundEventRequest req) {
        RawChainEvent raw = toRawEvent(req);
        log.info("event=inbound_event.request eventId={} kind={}", raw.eventId(), raw.kind());
        DispatchOutcome outcome = dispatcher.dispatch(raw);
        log.info("event=inbound_event.response eventId={} outcome={}", raw.eventId(), outcome);
        return ResponseEntity.ok(new InboundEventResponse(raw.eventId(), outcome));
    }

    private RawChainEvent toRawEvent(InboundEventRequest req) {
        if (req.logIndex() == null) {
            throw new InvalidRequestException("logIndex is required");
        }
        try {
            return new RawChainEvent(
                    req.sourceChain(),
                    req.txId(),
                    req.logIndex(),
                    req.kind(),
                    decodeHex(req.payloadHex(), "payloadHex"),
                    req.signatureHex() == null || req.signatureHex().isBlank() ? null : decodeHex(req.signatureHex(), "signatureHex")
            );
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException(e.getMessage());
        }
    }

    private static byte[] decodeHex(String hex, String field) {
        if (hex == null || hex.isBlank()) {
            return new byte[0];
        }
        String clean = Numeric.cleanHexPrefix(hex.trim());
        if (clean.length() % 2 != 0 || !clean.matches("[0-9a-fA-F]*")) {
            throw new IllegalArgumentException(field + " must be an even-length hex string");
        }
        return Numeric.hexStringToByteArray(clean);
    }

    public record InboundEventResponse(
            String eventId,
            DispatchOutcome outcome
    ) {}
}
