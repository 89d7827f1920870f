package lab.relay.adapter;

import org.web3j.crypto.RawTransaction;

/**
 * Signing capability for relay transactions. Key custody stays behind this interface.
 */
public interface Signer {

    // Returns the signed transaction as 0x-prefixed hex.
    String sign(RawTransaction tx, long chainId);

    String getAddress();
}
