package lab.relay.adapter;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionEncoder;
import org.web3j.crypto.WalletUtils;
import org.web3j.utils.Numeric;

/**
 * Holds the relay's sending key in process and signs bridge transactions with EIP-155 replay protection.
 */
@Component
@ConditionalOnProperty(prefix = "relay.chain", name = "mode", havingValue = "rpc")
@Slf4j
public class EvmSigner implements Signer {

    private final Credentials relayCredentials;

    public EvmSigner(@Value("${relay.evm.private-key:}") String privateKey) {
        String key = privateKey == null ? "" : privateKey.trim();
        if (key.isEmpty()) {
            throw new IllegalStateException("relay.evm.private-key must be configured when relay.chain.mode=rpc");
        }
        if (!WalletUtils.isValidPrivateKey(key)) {
            throw new IllegalStateException("relay.evm.private-key is not a 32-byte hex key");
        }
        this.relayCredentials = Credentials.create(key);
        log.info("event=signer.loaded relaySender={}", relayCredentials.getAddress());
    }

    @Override
    public String sign(RawTransaction bridgeTx, long chainId) {
        return Numeric.toHexString(TransactionEncoder.signMessage(bridgeTx, chainId, relayCredentials));
    }

    @Override
    public String getAddress() {
        return relayCredentials.getAddress();
    }
}
