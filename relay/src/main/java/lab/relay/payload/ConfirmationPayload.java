package lab.relay.payload;

import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.Utils;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.utils.Numeric;

import java.util.List;
import java.util.UUID;

/**
 * Body of a TransferCompleted/TransferFailed notification: {@code (bytes32 transferId, string detail)}.
 * The transfer id is part of the signed payload, binding a signature to one transfer.
 */
public record ConfirmationPayload(
        UUID transferId,
        String detail
) {

    private static final List<TypeReference<?>> LAYOUT = List.of(
            new TypeReference<Bytes32>() {},
            new TypeReference<Utf8String>() {}
    );

    public byte[] encode() {
        List<Type> params = List.of(
                new Bytes32(Bytes32Ids.fromUuid(transferId)),
                new Utf8String(detail == null ? "" : detail)
        );
        return Numeric.hexStringToByteArray(FunctionEncoder.encodeConstructor(params));
    }

    public static ConfirmationPayload decode(byte[] payload) {
        if (payload == null || payload.length < 96) {
            throw new IllegalArgumentException("confirmation payload too short");
        }
        List<Type> values = FunctionReturnDecoder.decode(Numeric.toHexString(payload), Utils.convert(LAYOUT));
        if (values.size() != 2) {
            throw new IllegalArgumentException("confirmation payload could not be decoded");
        }
        UUID transferId = Bytes32Ids.toUuid(((Bytes32) values.get(0)).getValue());
        return new ConfirmationPayload(transferId, ((Utf8String) values.get(1)).getValue());
    }
}
