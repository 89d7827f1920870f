package lab.relay.payload;

import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.Utils;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.List;

/**
 * Asset-transfer record carried as an ABI-encoded {@code (address owner, address to, uint256 tokenId)} tuple.
 */
public record AssetTransferPayload(
        String owner,
        String to,
        BigInteger tokenId
) {

    private static final List<TypeReference<?>> LAYOUT = List.of(
            new TypeReference<Address>() {},
            new TypeReference<Address>() {},
            new TypeReference<Uint256>() {}
    );

    public byte[] encode() {
        List<Type> params = List.of(new Address(owner), new Address(to), new Uint256(tokenId));
        return Numeric.hexStringToByteArray(FunctionEncoder.encodeConstructor(params));
    }

    public static AssetTransferPayload decode(byte[] payload) {
        if (payload == null || payload.length != 96) {
            throw new IllegalArgumentException("asset payload must be 96 bytes, got " + (payload == null ? 0 : payload.length));
        }
        List<Type> values = FunctionReturnDecoder.decode(Numeric.toHexString(payload), Utils.convert(LAYOUT));
        if (values.size() != 3) {
            throw new IllegalArgumentException("asset payload could not be decoded");
        }
        return new AssetTransferPayload(
                ((Address) values.get(0)).getValue(),
                ((Address) values.get(1)).getValue(),
                ((Uint256) values.get(2)).getValue()
        );
    }
}
