package lab.relay.event;

import org.web3j.abi.EventEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Type;
import org.web3j.protocol.core.methods.response.Log;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Bridge contract log layout. Every relay event is emitted as {@code Name(bytes payload, bytes signature)}, the
 * signature covering {@link EventAttestations#signingDigest} of the event's kind, source chain and payload.
 */
public final class BridgeEvents {

    private static final List<TypeReference<?>> PAYLOAD_AND_SIGNATURE = List.of(
            new TypeReference<DynamicBytes>() {},
            new TypeReference<DynamicBytes>() {}
    );

    public static final Event TRANSFER_INITIATED = new Event("TransferInitiated", PAYLOAD_AND_SIGNATURE);
    public static final Event TRANSFER_COMPLETED = new Event("TransferCompleted", PAYLOAD_AND_SIGNATURE);
    public static final Event TRANSFER_FAILED = new Event("TransferFailed", PAYLOAD_AND_SIGNATURE);
    public static final Event MESSAGE_RECEIVED = new Event("MessageReceived", PAYLOAD_AND_SIGNATURE);

    private static final Map<String, RelayEventKind> KIND_BY_TOPIC = Map.of(
            topic(TRANSFER_INITIATED), RelayEventKind.TRANSFER_INITIATED,
            topic(TRANSFER_COMPLETED), RelayEventKind.TRANSFER_COMPLETED,
            topic(TRANSFER_FAILED), RelayEventKind.TRANSFER_FAILED,
            topic(MESSAGE_RECEIVED), RelayEventKind.GENERIC_MESSAGE
    );

    private BridgeEvents() {
    }

    public static String topic(Event event) {
        return EventEncoder.encode(event).toLowerCase(Locale.ROOT);
    }

    // Unknown topics and undecodable data yield empty; the bridge may emit logs this service does not consume.
    public static Optional<RawChainEvent> toRawEvent(String sourceChain, Log log) {
        if (log.getTopics() == null || log.getTopics().isEmpty()) {
            return Optional.empty();
        }
        RelayEventKind kind = KIND_BY_TOPIC.get(log.getTopics().get(0).toLowerCase(Locale.ROOT));
        if (kind == null) {
            return Optional.empty();
        }
        List<Type> values = FunctionReturnDecoder.decode(log.getData(), TRANSFER_COMPLETED.getNonIndexedParameters());
        if (values.size() != 2) {
            return Optional.empty();
        }
        byte[] payload = ((DynamicBytes) values.get(0)).getValue();
        byte[] signature = ((DynamicBytes) values.get(1)).getValue();
        return Optional.of(new RawChainEvent(
                sourceChain,
                log.getTransactionHash(),
                log.getLogIndex().longValueExact(),
                kind,
                payload,
                signature.length == 0 ? null : signature
        ));
    }
}
