package lab.relay.auth;

import org.springframework.stereotype.Component;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;

import java.math.BigInteger;
import java.security.SignatureException;
import java.util.Arrays;

/**
 * EIP-191 personal-message recovery: the 65-byte {@code r || s || v} signature over
 * {@code "\x19Ethereum Signed Message:\n" + len + message} yields the signer's address.
 */
@Component
public class EthSignatureRecovery implements SignatureRecovery {

    @Override
    public String recover(byte[] message, byte[] signature) throws SignatureException {
        if (message == null) {
            throw new SignatureException("message is required");
        }
        if (signature == null || signature.length != 65) {
            throw new SignatureException("signature must be 65 bytes");
        }
        byte v = signature[64];
        if (v < 27) {
            v += 27;
        }
        Sign.SignatureData signatureData = new Sign.SignatureData(
                v,
                Arrays.copyOfRange(signature, 0, 32),
                Arrays.copyOfRange(signature, 32, 64)
        );
        try {
            BigInteger publicKey = Sign.signedPrefixedMessageToKey(message, signatureData);
            return "0x" + Keys.getAddress(publicKey);
        } catch (IllegalArgumentException e) {
            throw new SignatureException("malformed signature: " + e.getMessage(), e);
        }
    }
}
