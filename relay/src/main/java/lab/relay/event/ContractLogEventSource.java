package lab.relay.event;

import io.reactivex.disposables.Disposable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.EthFilter;

import java.util.function.Consumer;

/**
 * Streams bridge contract logs from the RPC node and converts them into raw relay events.
 */
@Component
@ConditionalOnProperty(prefix = "relay.chain", name = "mode", havingValue = "rpc")
@Slf4j
public class ContractLogEventSource implements EventSource {

    private final Web3j web3j;
    private final String bridgeAddress;
    private final String sourceChain;

    public ContractLogEventSource(
            Web3j web3j,
            @Value("${relay.evm.bridge-address}") String bridgeAddress,
            @Value("${relay.evm.source-chain:sepolia}") String sourceChain) {
        this.web3j = web3j;
        this.bridgeAddress = bridgeAddress;
        this.sourceChain = sourceChain;
    }

    @Override
    public String name() {
        return "bridge-logs-" + sourceChain;
    }

    @Override
    public Subscription subscribe(Consumer<RawChainEvent> listener) {
        EthFilter filter = new EthFilter(DefaultBlockParameterName.LATEST, DefaultBlockParameterName.LATEST, bridgeAddress);
        Disposable disposable = web3j.ethLogFlowable(filter).subscribe(
                logEntry -> {
                    try {
                        BridgeEvents.toRawEvent(sourceChain, logEntry).ifPresentOrElse(
                                listener,
                                () -> log.debug("event=chain_log.ignored txId={} topics={}",
                                        logEntry.getTransactionHash(), logEntry.getTopics())
                        );
                    } catch (RuntimeException e) {
                        log.warn("event=chain_log.decode_failed txId={} error={}", logEntry.getTransactionHash(), e.getMessage());
                    }
                },
                error -> log.error("event=chain_log.stream_failed source={} error={}", name(), error.getMessage(), error)
        );
        log.info("event=chain_log.subscribed source={} bridge={}", name(), bridgeAddress);
        return disposable::dispose;
    }
}
