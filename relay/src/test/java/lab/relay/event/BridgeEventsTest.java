package lab.relay.event;

import org.junit.jupiter.api.Test;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.Type;
import org.web3j.protocol.core.methods.response.Log;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class BridgeEventsTest {

    @Test
    void decodesCompletedLogIntoRawEvent() {
        byte[] payload = "payload".getBytes(StandardCharsets.UTF_8);
        byte[] signature = new byte[65];
        signature[64] = 27;
        Log log = log(BridgeEvents.topic(BridgeEvents.TRANSFER_COMPLETED), payload, signature);

        Optional<RawChainEvent> raw = BridgeEvents.toRawEvent("sepolia", log);

        assertThat(raw).hasValueSatisfying(e -> {
            assertThat(e.kind()).isEqualTo(RelayEventKind.TRANSFER_COMPLETED);
            assertThat(e.eventId()).isEqualTo("sepolia:0xfeed:3");
            assertThat(e.payload()).isEqualTo(payload);
            assertThat(e.signature()).isEqualTo(signature);
        });
    }

    @Test
    void messageReceivedMapsToGenericMessage() {
        Log log = log(BridgeEvents.topic(BridgeEvents.MESSAGE_RECEIVED), new byte[]{1}, new byte[0]);

        assertThat(BridgeEvents.toRawEvent("sepolia", log))
                .hasValueSatisfying(e -> {
                    assertThat(e.kind()).isEqualTo(RelayEventKind.GENERIC_MESSAGE);
                    assertThat(e.signature()).isNull();
                });
    }

    @Test
    void unknownTopicIsIgnored() {
        Log log = log("0x" + "00".repeat(32), new byte[]{1}, new byte[]{2});

        assertThat(BridgeEvents.toRawEvent("sepolia", log)).isEmpty();
    }

    private static Log log(String topic0, byte[] payload, byte[] signature) {
        List<Type> values = List.of(new DynamicBytes(payload), new DynamicBytes(signature));
        Log log = new Log();
        log.setTopics(List.of(topic0));
        log.setData("0x" + FunctionEncoder.encodeConstructor(values));
        log.setTransactionHash("0xFEED");
        log.setLogIndex("0x3");
        return log;
    }
}
