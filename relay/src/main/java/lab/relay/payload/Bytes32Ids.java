package lab.relay.payload;

import java.nio.ByteBuffer;
import java.util.UUID;

/**
 * Transfer ids travel on chain as bytes32: the 16 UUID bytes left-aligned, zero padded.
 */
public final class Bytes32Ids {

    private Bytes32Ids() {
    }

    public static byte[] fromUuid(UUID id) {
        ByteBuffer buffer = ByteBuffer.allocate(32);
        buffer.putLong(id.getMostSignificantBits());
        buffer.putLong(id.getLeastSignificantBits());
        return buffer.array();
    }

    public static UUID toUuid(byte[] bytes32) {
        if (bytes32 == null || bytes32.length != 32) {
            throw new IllegalArgumentException("transfer id must be 32 bytes");
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes32);
        return new UUID(buffer.getLong(), buffer.getLong());
    }
}
