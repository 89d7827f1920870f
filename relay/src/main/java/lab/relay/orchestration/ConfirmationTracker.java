package lab.relay.orchestration;

import jakarta.annotation.PreDestroy;
import lab.relay.adapter.ChainAdapter;
import lab.relay.retry.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Polls the chain adapter for the receipt of an accepted submission and feeds the result into the same
 * confirmation transition that inbound events use. Whichever arrives first wins; the other is dropped.
 */
@Component
@Slf4j
public class ConfirmationTracker {

    @FunctionalInterface
    public interface ConfirmationCallback {
        boolean apply(UUID transferId, boolean success, String detail);
    }

    private final ChainAdapter chainAdapter;
    private final Duration pollInterval;
    private final int maxPolls;
    private final Sleeper sleeper;

    private final ExecutorService executor = Executors.newCachedThreadPool();

    @Autowired
    public ConfirmationTracker(
            ChainAdapter chainAdapter,
            @Value("${relay.confirmation.poll-interval:2s}") Duration pollInterval,
            @Value("${relay.confirmation.max-polls:60}") int maxPolls) {
        this(chainAdapter, pollInterval, maxPolls, Sleeper.THREAD);
    }

    ConfirmationTracker(ChainAdapter chainAdapter, Duration pollInterval, int maxPolls, Sleeper sleeper) {
        this.chainAdapter = chainAdapter;
        this.pollInterval = pollInterval;
        this.maxPolls = maxPolls;
        this.sleeper = sleeper;
    }

    public void startTracking(UUID transferId, String txHandle, ConfirmationCallback callback) {
        log.info("event=confirmation_tracker.start transferId={} txHandle={}", transferId, txHandle);
        executor.submit(() -> track(transferId, txHandle, callback));
    }

    void track(UUID transferId, String txHandle, ConfirmationCallback callback) {
        try {
            for (int poll = 1; poll <= maxPolls; poll++) {
                try {
                    Optional<ChainAdapter.Receipt> receipt = chainAdapter.findReceipt(txHandle);
                    if (receipt.isPresent()) {
                        ChainAdapter.Receipt r = receipt.get();
                        String detail = r.success()
                                ? "receipt block=" + r.blockNumber()
                                : "transaction reverted in block " + r.blockNumber();
                        boolean applied = callback.apply(transferId, r.success(), detail);
                        log.info(
                                "event=confirmation_tracker.receipt transferId={} txHandle={} success={} block={} applied={}",
                                transferId,
                                txHandle,
                                r.success(),
                                r.blockNumber(),
                                applied
                        );
                        return;
                    }
                } catch (RuntimeException e) {
                    log.warn("event=confirmation_tracker.poll_failed transferId={} txHandle={} poll={} error={}",
                            transferId, txHandle, poll, e.getMessage());
                }
                sleeper.sleep(pollInterval);
            }
            // Left AWAITING_CONFIRMATION: a late inbound event can still settle it.
            log.warn("event=confirmation_tracker.timeout transferId={} txHandle={} polls={}", transferId, txHandle, maxPolls);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("event=confirmation_tracker.interrupted transferId={}", transferId);
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
