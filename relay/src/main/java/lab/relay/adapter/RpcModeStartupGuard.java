package lab.relay.adapter;

import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "relay.chain", name = "mode", havingValue = "rpc")
public class RpcModeStartupGuard {

    @Value("${relay.evm.chain-id}")
    private long chainId;

    @Value("${relay.evm.private-key:}")
    private String privateKey;

    @Value("${relay.evm.rpc-url:}")
    private String rpcUrl;

    @Value("${relay.evm.bridge-address:}")
    private String bridgeAddress;

    @Value("${relay.evm.allow-mainnet:false}")
    private boolean allowMainnet;

    @PostConstruct
    void validate() {
        if (chainId == 1 && !allowMainnet) {
            throw new IllegalStateException("Mainnet(chain-id=1) requires relay.evm.allow-mainnet=true");
        }
        if (privateKey == null || privateKey.isBlank()) {
            throw new IllegalStateException("RELAY_EVM_PRIVATE_KEY must be configured in rpc mode");
        }
        if (rpcUrl == null || rpcUrl.isBlank()) {
            throw new IllegalStateException("RELAY_EVM_RPC_URL must be configured in rpc mode");
        }
        if (bridgeAddress == null || bridgeAddress.isBlank()) {
            throw new IllegalStateException("RELAY_EVM_BRIDGE_ADDRESS must be configured in rpc mode");
        }
    }
}
