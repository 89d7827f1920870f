package lab.relay.adapter;

import lab.relay.payload.Bytes32Ids;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint16;
import org.web3j.crypto.RawTransaction;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.response.EthChainId;
import org.web3j.protocol.core.methods.response.EthGetTransactionCount;
import org.web3j.protocol.core.methods.response.EthGetTransactionReceipt;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

@Component
@ConditionalOnProperty(prefix = "relay.chain", name = "mode", havingValue = "rpc")
@Slf4j
public class EvmRpcAdapter implements ChainAdapter {

    private static final Pattern EVM_ADDRESS_PATTERN = Pattern.compile("^0x[a-fA-F0-9]{40}$");
    private static final BigInteger DEFAULT_MAX_PRIORITY_FEE_PER_GAS = BigInteger.valueOf(2_000_000_000L);
    private static final BigInteger DEFAULT_MAX_FEE_PER_GAS = BigInteger.valueOf(20_000_000_000L);

    // RPC error fragments that usually clear up on a later attempt.
    private static final List<String> TRANSIENT_RPC_ERRORS = List.of(
            "nonce too low",
            "replacement transaction underpriced",
            "already known",
            "timeout",
            "timed out",
            "header not found",
            "too many requests",
            "rate limit"
    );

    private final Web3j web3j;
    private final long configuredChainId;
    private final String bridgeAddress;
    private final BigInteger gasLimit;
    private final Signer signer;

    public EvmRpcAdapter(
            Web3j web3j,
            @Value("${relay.evm.chain-id}") long configuredChainId,
            @Value("${relay.evm.bridge-address}") String bridgeAddress,
            @Value("${relay.evm.gas-limit:300000}") long gasLimit,
            Signer signer
    ) {
        this.web3j = web3j;
        this.configuredChainId = configuredChainId;
        this.bridgeAddress = bridgeAddress;
        this.gasLimit = BigInteger.valueOf(gasLimit);
        this.signer = signer;
    }

    // Encode initiateTransfer(uint16,bytes32,address,bytes) on the bridge contract and pay the relay fee as value.
    @Override
    public SubmitResult submit(SubmitCommand command) {
        if (!isValidAddress(command.to())) {
            throw new PermanentChainException("Invalid EVM recipient address: " + command.to());
        }

        ensureConnectedChainIdMatchesConfigured();

        Function initiateTransfer = new Function(
                "initiateTransfer",
                List.of(
                        new Uint16(command.destinationEndpointId()),
                        new Bytes32(Bytes32Ids.fromUuid(command.transferId())),
                        new Address(command.to()),
                        new DynamicBytes(command.payload())
                ),
                Collections.emptyList()
        );

        try {
            BigInteger nonce = getPendingNonce(signer.getAddress());
            RawTransaction rawTransaction = RawTransaction.createTransaction(
                    configuredChainId,
                    nonce,
                    gasLimit,
                    bridgeAddress,
                    BigInteger.valueOf(command.maxFeeWei()),
                    FunctionEncoder.encode(initiateTransfer),
                    DEFAULT_MAX_PRIORITY_FEE_PER_GAS,
                    DEFAULT_MAX_FEE_PER_GAS
            );

            String signedTxHex = signer.sign(rawTransaction, configuredChainId);
            EthSendTransaction sent = web3j.ethSendRawTransaction(signedTxHex).send();
            if (sent.hasError()) {
                throw classifyRpcError("EVM RPC rejected transaction", sent.getError());
            }

            String txHash = sent.getTransactionHash();
            if (txHash == null || txHash.isBlank()) {
                throw new TransientChainException("RPC returned an empty tx hash");
            }
            log.info("event=rpc_adapter.submit.sent transferId={} txHash={} nonce={}", command.transferId(), txHash, nonce);
            return new SubmitResult(txHash, true);
        } catch (IOException e) {
            throw new TransientChainException("Failed to execute EVM RPC request", e);
        }
    }

    @Override
    public Optional<Receipt> findReceipt(String txHandle) {
        try {
            EthGetTransactionReceipt response = web3j.ethGetTransactionReceipt(txHandle).send();
            if (response.hasError()) {
                throw classifyRpcError("Failed to fetch receipt", response.getError());
            }
            return response.getTransactionReceipt().map(this::toReceipt);
        } catch (IOException e) {
            throw new TransientChainException("Failed to fetch receipt", e);
        }
    }

    @Override
    public boolean supportsReceiptPolling() {
        return true;
    }

    // Pending nonce: counts in-flight submissions.
    public BigInteger getPendingNonce(String address) throws IOException {
        EthGetTransactionCount txCountResponse = web3j.ethGetTransactionCount(address, DefaultBlockParameterName.PENDING).send();
        if (txCountResponse.hasError()) {
            throw classifyRpcError("Failed to fetch nonce from RPC", txCountResponse.getError());
        }
        return txCountResponse.getTransactionCount();
    }

    // Safety check against sending to the wrong chain when config and RPC endpoint disagree.
    private void ensureConnectedChainIdMatchesConfigured() {
        try {
            EthChainId chainIdResponse = web3j.ethChainId().send();
            if (chainIdResponse.hasError()) {
                throw classifyRpcError("Failed to verify chain id from RPC", chainIdResponse.getError());
            }
            long remoteChainId = chainIdResponse.getChainId().longValue();
            if (remoteChainId != configuredChainId) {
                throw new PermanentChainException("Connected RPC chain id mismatch. expected=" + configuredChainId + ", actual=" + remoteChainId);
            }
        } catch (IOException e) {
            throw new TransientChainException("Failed to verify chain id from RPC", e);
        }
    }

    private Receipt toReceipt(TransactionReceipt receipt) {
        long blockNumber = receipt.getBlockNumberRaw() != null ? receipt.getBlockNumber().longValue() : -1L;
        return new Receipt(receipt.getTransactionHash(), receipt.isStatusOK(), blockNumber);
    }

    static RuntimeException classifyRpcError(String context, Response.Error error) {
        String message = error.getMessage() == null ? "" : error.getMessage();
        String normalized = message.toLowerCase(Locale.ROOT);
        boolean transientError = TRANSIENT_RPC_ERRORS.stream().anyMatch(normalized::contains);
        String detail = context + ": " + message;
        return transientError ? new TransientChainException(detail) : new PermanentChainException(detail);
    }

    private static boolean isValidAddress(String address) {
        return address != null && EVM_ADDRESS_PATTERN.matcher(address).matches();
    }
}
