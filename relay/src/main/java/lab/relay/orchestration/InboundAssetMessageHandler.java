package lab.relay.orchestration;

import jakarta.annotation.PostConstruct;
import lab.relay.event.RelayEvent;
import lab.relay.event.RelayEventDispatcher;
import lab.relay.event.RelayEventKind;
import lab.relay.payload.AssetTransferPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.crypto.WalletUtils;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Receiving side of an asset relay: decodes the asset record carried by an authenticated generic message.
 * Malformed records are logged and dropped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InboundAssetMessageHandler {

    private static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private final RelayEventDispatcher dispatcher;
    private final AtomicLong accepted = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    @PostConstruct
    void register() {
        dispatcher.subscribe(RelayEventKind.GENERIC_MESSAGE, this::handle);
    }

    public void handle(RelayEvent event) {
        AssetTransferPayload asset;
        try {
            asset = AssetTransferPayload.decode(event.payload());
        } catch (IllegalArgumentException e) {
            drop(event, "undecodable: " + e.getMessage());
            return;
        }
        if (!WalletUtils.isValidAddress(asset.to()) || ZERO_ADDRESS.equalsIgnoreCase(asset.to())) {
            drop(event, "invalid recipient " + asset.to());
            return;
        }
        if (asset.tokenId().signum() <= 0) {
            drop(event, "non-positive tokenId " + asset.tokenId());
            return;
        }
        accepted.incrementAndGet();
        log.info(
                "event=inbound_asset.accepted eventId={} sourceChain={} owner={} to={} tokenId={} signer={}",
                event.eventId(),
                event.sourceChain(),
                asset.owner(),
                asset.to(),
                asset.tokenId(),
                event.signer()
        );
    }

    public long acceptedCount() {
        return accepted.get();
    }

    public long droppedCount() {
        return dropped.get();
    }

    private void drop(RelayEvent event, String reason) {
        dropped.incrementAndGet();
        log.warn("event=inbound_asset.dropped eventId={} sourceChain={} reason={}", event.eventId(), event.sourceChain(), reason);
    }
}
