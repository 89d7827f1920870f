package lab.relay.adapter;

import lab.relay.sim.fakechain.FakeChain;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Hash;
import org.web3j.crypto.RawTransaction;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Chain adapter for mock mode. Builds the same raw transaction shape as the RPC adapter, hashes the signer output
 * into a tx handle, and takes the submission outcome from {@link FakeChain} so failures can be scripted.
 * Confirmation only arrives through inbound events or the simulation endpoint.
 */
@Component
@ConditionalOnProperty(prefix = "relay.chain", name = "mode", havingValue = "mock", matchIfMissing = true)
@Slf4j
public class EvmMockAdapter implements ChainAdapter {

    private static final long MOCK_CHAIN_ID = 31337L;
    private static final BigInteger GAS_LIMIT = BigInteger.valueOf(300_000);
    private static final BigInteger GAS_PRICE = BigInteger.valueOf(1_000_000_000L);

    private final FakeChain fakeChain;
    private final Signer signer;
    private final AtomicLong nonce = new AtomicLong();

    public EvmMockAdapter(FakeChain fakeChain, Signer signer) {
        this.fakeChain = fakeChain;
        this.signer = signer;
    }

    @Override
    public SubmitResult submit(SubmitCommand command) {
        FakeChain.NextOutcome outcome = fakeChain.consumeOutcome(command.transferId());
        log.info("event=mock_adapter.submit transferId={} destinationChain={} outcome={}", command.transferId(), command.destinationChain(), outcome);
        switch (outcome) {
            case TRANSIENT_FAILURE -> throw new TransientChainException("simulated transport timeout");
            case PERMANENT_FAILURE -> throw new PermanentChainException("simulated rejection: invalid recipient " + command.to());
            default -> {
                // fall through to acceptance
            }
        }

        RawTransaction tx = RawTransaction.createTransaction(
                BigInteger.valueOf(nonce.getAndIncrement()),
                GAS_PRICE,
                GAS_LIMIT,
                command.to(),
                BigInteger.valueOf(command.maxFeeWei()),
                Numeric.toHexString(command.payload())
        );
        String txHandle = Hash.sha3(signer.sign(tx, MOCK_CHAIN_ID));
        return new SubmitResult(txHandle, true);
    }

    @Override
    public Optional<Receipt> findReceipt(String txHandle) {
        return Optional.empty();
    }
}
