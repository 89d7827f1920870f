package lab.relay.event;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class EventAttestationsTest {

    private final byte[] payload = "transfer 42 done".getBytes(StandardCharsets.UTF_8);

    @Test
    void digestIsStableAndIgnoresChainCase() {
        byte[] digest = EventAttestations.signingDigest(RelayEventKind.TRANSFER_COMPLETED, "sepolia", payload);

        assertThat(digest).hasSize(32);
        assertThat(EventAttestations.signingDigest(RelayEventKind.TRANSFER_COMPLETED, " Sepolia ", payload))
                .isEqualTo(digest);
        assertThat(EventAttestations.signingDigest(
                new RawChainEvent("sepolia", "0xabc", 3, RelayEventKind.TRANSFER_COMPLETED, payload, null)))
                .isEqualTo(digest);
    }

    @Test
    void digestBindsKindChainAndPayload() {
        byte[] digest = EventAttestations.signingDigest(RelayEventKind.TRANSFER_COMPLETED, "sepolia", payload);

        assertThat(EventAttestations.signingDigest(RelayEventKind.TRANSFER_FAILED, "sepolia", payload))
                .isNotEqualTo(digest);
        assertThat(EventAttestations.signingDigest(RelayEventKind.TRANSFER_COMPLETED, "amoy", payload))
                .isNotEqualTo(digest);
        assertThat(EventAttestations.signingDigest(RelayEventKind.TRANSFER_COMPLETED, "sepolia", new byte[]{1}))
                .isNotEqualTo(digest);
    }

    @Test
    void replayKeyIsPrefixedHex() {
        byte[] digest = EventAttestations.signingDigest(RelayEventKind.GENERIC_MESSAGE, "sepolia", payload);

        assertThat(EventAttestations.replayKey(digest)).startsWith("attestation:0x").hasSize("attestation:0x".length() + 64);
    }
}
