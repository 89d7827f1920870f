package lab.relay.adapter;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionEncoder;
import org.web3j.utils.Numeric;

@Component
@ConditionalOnProperty(prefix = "relay.chain", name = "mode", havingValue = "mock", matchIfMissing = true)
public class MockSigner implements Signer {

    static final String MOCK_SENDER = "0x000000000000000000000000000000000000dead";

    // Unsigned encoding is enough to derive a stable, content-dependent tx hash in mock mode.
    @Override
    public String sign(RawTransaction tx, long chainId) {
        return Numeric.toHexString(TransactionEncoder.encode(tx, chainId));
    }

    @Override
    public String getAddress() {
        return MOCK_SENDER;
    }
}
