package lab.relay.event;

import lab.relay.auth.SignatureAuthorizationVerifier;
import lab.relay.auth.VerificationResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Handler registry keyed by event kind, plus the per-event pipeline: deduplicate, authenticate, fan out.
 * <p>
 * An event id is marked seen before authentication, so a rejected or partially handled event is never processed
 * again when redelivered. Signed kinds are verified against {@link EventAttestations#signingDigest}, and an
 * accepted digest is also marked seen: the same attestation under a different event id is rejected.
 * Handlers run synchronously and each failure is caught and logged on its own.
 */
@Slf4j
public class RelayEventDispatcher {

    private final EventDedupSet dedupSet;
    private final SignatureAuthorizationVerifier verifier;
    private final String requiredRole;
    private final Clock clock;
    private final Map<RelayEventKind, List<RelayEventHandler>> handlersByKind = new ConcurrentHashMap<>();

    public RelayEventDispatcher(
            EventDedupSet dedupSet,
            SignatureAuthorizationVerifier verifier,
            String requiredRole,
            Clock clock) {
        this.dedupSet = dedupSet;
        this.verifier = verifier;
        this.requiredRole = requiredRole;
        this.clock = clock;
    }

    public HandlerRegistration subscribe(RelayEventKind kind, RelayEventHandler handler) {
        List<RelayEventHandler> handlers = handlersByKind.computeIfAbsent(kind, k -> new CopyOnWriteArrayList<>());
        handlers.add(handler);
        log.info("event=dispatcher.subscribed kind={} handlers={}", kind, handlers.size());
        return () -> handlers.remove(handler);
    }

    public DispatchOutcome dispatch(RawChainEvent raw) {
        String eventId = raw.eventId();
        if (!dedupSet.markSeen(eventId)) {
            log.info("event=dispatcher.duplicate eventId={} kind={}", eventId, raw.kind());
            return DispatchOutcome.DUPLICATE;
        }

        String signer = null;
        if (raw.kind().requiresAuthorization()) {
            byte[] digest = EventAttestations.signingDigest(raw);
            VerificationResult result = verifier.verifyAuthorized(digest, raw.signature(), requiredRole);
            if (!result.authorized()) {
                log.warn(
                        "event=dispatcher.rejected eventId={} kind={} sourceChain={} identity={} reason={}",
                        eventId,
                        raw.kind(),
                        raw.sourceChain(),
                        result.identity(),
                        result.reason()
                );
                return DispatchOutcome.REJECTED;
            }
            // A signed attestation is honoured once, whatever event id it arrives under.
            if (!dedupSet.markSeen(EventAttestations.replayKey(digest))) {
                log.warn("event=dispatcher.replayed eventId={} kind={} sourceChain={} identity={}",
                        eventId, raw.kind(), raw.sourceChain(), result.identity());
                return DispatchOutcome.REJECTED;
            }
            signer = result.identity();
        }

        RelayEvent event = new RelayEvent(
                eventId,
                raw.kind(),
                raw.payload(),
                raw.sourceChain(),
                raw.txId(),
                clock.instant(),
                signer
        );

        List<RelayEventHandler> handlers = handlersByKind.getOrDefault(raw.kind(), List.of());
        for (RelayEventHandler handler : handlers) {
            try {
                handler.handle(event);
            } catch (Exception e) {
                log.error("event=dispatcher.handler_failed eventId={} kind={} handler={} error={}",
                        eventId, raw.kind(), handler.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
        log.info("event=dispatcher.dispatched eventId={} kind={} handlers={} signer={}", eventId, raw.kind(), handlers.size(), signer);
        return DispatchOutcome.DISPATCHED;
    }

    public int handlerCount(RelayEventKind kind) {
        return handlersByKind.getOrDefault(kind, List.of()).size();
    }
}
