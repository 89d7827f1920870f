package lab.relay.event;

import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.util.List;
import java.util.Locale;

/**
 * What an admin signs to vouch for a relay event: the EIP-191 message is
 * {@code keccak256(abi.encode(string kind, string sourceChain, bytes payload))}.
 * <p>
 * The kind and source chain are bound so a signature cannot be moved to another event kind or chain. Transaction
 * coordinates are not bound, since a signature carried inside a bridge log cannot cover its own transaction hash;
 * the dispatcher instead accepts each digest once.
 */
public final class EventAttestations {

    private static final String REPLAY_KEY_PREFIX = "attestation:";

    private EventAttestations() {
    }

    public static byte[] signingDigest(RelayEventKind kind, String sourceChain, byte[] payload) {
        List<Type> fields = List.of(
                new Utf8String(kind.name()),
                new Utf8String(sourceChain.trim().toLowerCase(Locale.ROOT)),
                new DynamicBytes(payload == null ? new byte[0] : payload)
        );
        return Hash.sha3(Numeric.hexStringToByteArray(FunctionEncoder.encodeConstructor(fields)));
    }

    public static byte[] signingDigest(RawChainEvent raw) {
        return signingDigest(raw.kind(), raw.sourceChain(), raw.payload());
    }

    // Dedup-set key under which an accepted digest is remembered.
    static String replayKey(byte[] digest) {
        return REPLAY_KEY_PREFIX + Numeric.toHexString(digest);
    }
}
