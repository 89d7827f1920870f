package lab.relay.orchestration;

import lab.relay.adapter.ChainAdapter;
import lab.relay.adapter.DestinationChains;
import lab.relay.adapter.PermanentChainException;
import lab.relay.adapter.TransientChainException;
import lab.relay.domain.transfer.PayloadKind;
import lab.relay.domain.transfer.TransferRequest;
import lab.relay.domain.transfer.TransferRequestRepository;
import lab.relay.domain.transfer.TransferState;
import lab.relay.event.RelayEvent;
import lab.relay.event.RelayEventKind;
import lab.relay.orchestration.policy.PolicyDecision;
import lab.relay.orchestration.policy.PolicyEngine;
import lab.relay.payload.AssetTransferPayload;
import lab.relay.payload.ConfirmationPayload;
import lab.relay.ratelimit.SlidingWindowRateLimiter;
import lab.relay.retry.RetryExecutor;
import lab.relay.retry.RetryExhaustedException;
import lab.relay.retry.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Drives outbound transfers through PENDING, SUBMITTING and AWAITING_CONFIRMATION to a terminal state.
 * <p>
 * Every read-check-transition on one request runs under that request's lock. The lock is never held across a
 * chain call; a second drive of the same request is rejected, not queued.
 */
@Service
@Slf4j
public class TransferOrchestrator {

    private static final BigDecimal WEI_PER_ETH = new BigDecimal("1000000000000000000");

    private final TransferRequestRepository repository;
    private final PolicyEngine policyEngine;
    private final SlidingWindowRateLimiter rateLimiter;
    private final RetryExecutor retryExecutor;
    private final RetryPolicy retryPolicy;
    private final ChainAdapter chainAdapter;
    private final DestinationChains destinationChains;
    private final ConfirmationTracker confirmationTracker;
    private final ExecutorService driveExecutor;
    private final Clock clock;
    private final boolean autoDrive;
    private final ConcurrentHashMap<UUID, ReentrantLock> requestLocks = new ConcurrentHashMap<>();

    public TransferOrchestrator(
            TransferRequestRepository repository,
            PolicyEngine policyEngine,
            @Qualifier("transferRateLimiter") SlidingWindowRateLimiter rateLimiter,
            RetryExecutor retryExecutor,
            @Qualifier("submissionRetryPolicy") RetryPolicy retryPolicy,
            ChainAdapter chainAdapter,
            DestinationChains destinationChains,
            ConfirmationTracker confirmationTracker,
            @Qualifier("transferDriveExecutor") ExecutorService driveExecutor,
            Clock clock,
            @Value("${relay.orchestrator.auto-drive:true}") boolean autoDrive) {
        this.repository = repository;
        this.policyEngine = policyEngine;
        this.rateLimiter = rateLimiter;
        this.retryExecutor = retryExecutor;
        this.retryPolicy = retryPolicy;
        this.chainAdapter = chainAdapter;
        this.destinationChains = destinationChains;
        this.confirmationTracker = confirmationTracker;
        this.driveExecutor = driveExecutor;
        this.clock = clock;
        this.autoDrive = autoDrive;
    }

    // Validation runs before the limiter: rejected requests consume no budget.
    public SubmitOutcome submit(CreateTransferRequest req) {
        PolicyDecision decision = policyEngine.evaluate(req);
        if (!decision.allowed()) {
            log.info("event=transfer.submit.invalid reason={}", decision.reason());
            return SubmitOutcome.invalid(decision.reason());
        }
        if (req.requestId() != null && repository.existsById(req.requestId())) {
            log.info("event=transfer.submit.invalid requestId={} reason=DUPLICATE_REQUEST_ID", req.requestId());
            return SubmitOutcome.invalid("DUPLICATE_REQUEST_ID: " + req.requestId());
        }

        String source = req.sourceIdentity().trim();
        if (!rateLimiter.admit(source)) {
            log.info("event=transfer.submit.rate_limited sourceIdentity={}", source);
            return SubmitOutcome.rateLimited("RATE_LIMITED: max " + rateLimiter.getMaxRequestsPerWindow()
                    + " requests per " + rateLimiter.getWindowDuration());
        }

        UUID id = req.requestId() != null ? req.requestId() : UUID.randomUUID();
        TransferRequest saved = repository.save(TransferRequest.pending(
                id,
                source,
                req.destinationIdentity().trim(),
                DestinationChains.normalize(req.destinationChain()),
                req.payloadKind(),
                encodePayload(req),
                ethToWei(req.maxFee()),
                clock.instant()
        ));
        log.info(
                "event=transfer.submit.accepted transferId={} sourceIdentity={} destinationChain={} payloadKind={} maxFeeWei={}",
                saved.getId(),
                saved.getSourceIdentity(),
                saved.getDestinationChain(),
                saved.getPayloadKind(),
                saved.getMaxFeeWei()
        );

        if (autoDrive) {
            scheduleDrive(saved.getId());
        }
        return SubmitOutcome.accepted(saved.getId());
    }

    public TransferRequest drive(UUID id) {
        TransferRequest request = mutate(id, r -> {
            if (r.getState() != TransferState.PENDING) {
                throw new IllegalTransferStateException(id, r.getState(), "drive");
            }
            r.transitionTo(TransferState.SUBMITTING, clock.instant());
        });
        log.info("event=transfer.drive.start transferId={} destinationChain={}", id, request.getDestinationChain());

        ChainAdapter.SubmitResult result;
        try {
            ChainAdapter.SubmitCommand command = toCommand(request);
            result = retryExecutor.execute(
                    () -> submitOnce(command),
                    retryPolicy,
                    e -> e instanceof TransientChainException,
                    attempt -> mutate(id, r -> r.recordAttempt(clock.instant()))
            );
        } catch (RetryExhaustedException e) {
            String error = "RETRY_EXHAUSTED after " + e.getAttempts() + " attempts: " + e.getCause().getMessage();
            log.warn("event=transfer.drive.failed transferId={} reason=retry_exhausted error={}", id, e.getCause().getMessage());
            return mutate(id, r -> r.markFailed(error, clock.instant()));
        } catch (RuntimeException e) {
            String error = "PERMANENT: " + e.getMessage();
            log.warn("event=transfer.drive.failed transferId={} reason=permanent error={}", id, e.getMessage());
            return mutate(id, r -> r.markFailed(error, clock.instant()));
        }

        TransferRequest accepted = mutate(id, r -> r.markAccepted(result.txHandle(), clock.instant()));
        log.info(
                "event=transfer.drive.accepted transferId={} txHandle={} attempts={} state={}",
                id,
                result.txHandle(),
                accepted.getAttempts(),
                accepted.getState()
        );
        if (chainAdapter.supportsReceiptPolling()) {
            confirmationTracker.startTracking(id, result.txHandle(), this::applyConfirmation);
        }
        return accepted;
    }

    public TransferRequest cancel(UUID id) {
        TransferRequest cancelled = mutate(id, r -> {
            if (r.getState() != TransferState.PENDING) {
                throw new IllegalTransferStateException(id, r.getState(), "cancel");
            }
            r.transitionTo(TransferState.CANCELLED, clock.instant());
        });
        log.info("event=transfer.cancelled transferId={}", id);
        return cancelled;
    }

    public void onConfirmationEvent(RelayEvent event) {
        if (event.kind() != RelayEventKind.TRANSFER_COMPLETED && event.kind() != RelayEventKind.TRANSFER_FAILED) {
            return;
        }
        ConfirmationPayload confirmation;
        try {
            confirmation = ConfirmationPayload.decode(event.payload());
        } catch (IllegalArgumentException e) {
            log.warn("event=transfer.confirmation.malformed eventId={} error={}", event.eventId(), e.getMessage());
            return;
        }
        boolean success = event.kind() == RelayEventKind.TRANSFER_COMPLETED;
        String detail = confirmation.detail() == null || confirmation.detail().isBlank()
                ? event.kind() + " via " + event.eventId()
                : confirmation.detail();
        applyConfirmation(confirmation.transferId(), success, detail);
    }

    /**
     * Settles a request that is awaiting confirmation. Returns false, without raising, when the request is unknown
     * or not awaiting confirmation.
     */
    public boolean applyConfirmation(UUID id, boolean success, String detail) {
        ReentrantLock lock = lockFor(id);
        lock.lock();
        try {
            TransferRequest request = repository.findById(id).orElse(null);
            if (request == null) {
                log.info("event=transfer.confirmation.unmatched transferId={} success={}", id, success);
                return false;
            }
            if (request.getState() != TransferState.AWAITING_CONFIRMATION) {
                log.info("event=transfer.confirmation.dropped transferId={} state={} success={}", id, request.getState(), success);
                return false;
            }
            if (success) {
                request.transitionTo(TransferState.COMPLETED, clock.instant());
            } else {
                request.markFailed("CONFIRMATION_FAILED: " + detail, clock.instant());
            }
            repository.save(request);
            log.info("event=transfer.confirmation.applied transferId={} state={} detail={}", id, request.getState(), detail);
        } finally {
            lock.unlock();
        }
        requestLocks.remove(id, lock);
        return true;
    }

    public TransferRequest getStatus(UUID id) {
        return repository.findById(id).orElseThrow(() -> new TransferNotFoundException(id));
    }

    public List<TransferRequest> listBySource(String sourceIdentity) {
        return repository.findBySourceIdentityOrderByCreatedAtAsc(sourceIdentity.trim());
    }

    private ChainAdapter.SubmitResult submitOnce(ChainAdapter.SubmitCommand command) {
        ChainAdapter.SubmitResult result = chainAdapter.submit(command);
        if (!result.accepted()) {
            throw new PermanentChainException("chain did not accept transfer " + command.transferId());
        }
        return result;
    }

    private ChainAdapter.SubmitCommand toCommand(TransferRequest request) {
        int endpointId = destinationChains.endpointId(request.getDestinationChain())
                .orElseThrow(() -> new PermanentChainException("unsupported destination chain: " + request.getDestinationChain()));
        return new ChainAdapter.SubmitCommand(
                request.getId(),
                request.getDestinationChain(),
                endpointId,
                request.getDestinationIdentity(),
                request.getPayload(),
                request.getMaxFeeWei()
        );
    }

    private void scheduleDrive(UUID id) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        try {
            driveExecutor.execute(() -> {
                if (context != null) {
                    MDC.setContextMap(context);
                }
                try {
                    drive(id);
                } catch (IllegalTransferStateException e) {
                    log.info("event=transfer.auto_drive.skipped transferId={} state={}", id, e.getCurrentState());
                } catch (RuntimeException e) {
                    log.error("event=transfer.auto_drive.failed transferId={} error={}", id, e.getMessage(), e);
                } finally {
                    MDC.clear();
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("event=transfer.auto_drive.rejected transferId={} error={}", id, e.getMessage());
        }
    }

    private TransferRequest mutate(UUID id, Consumer<TransferRequest> mutation) {
        ReentrantLock lock = lockFor(id);
        TransferRequest saved;
        lock.lock();
        try {
            TransferRequest request = repository.findById(id).orElseThrow(() -> new TransferNotFoundException(id));
            mutation.accept(request);
            saved = repository.save(request);
        } finally {
            lock.unlock();
        }
        if (saved.getState().isTerminal()) {
            requestLocks.remove(id, lock);
        }
        return saved;
    }

    private ReentrantLock lockFor(UUID id) {
        return requestLocks.computeIfAbsent(id, key -> new ReentrantLock());
    }

    private static byte[] encodePayload(CreateTransferRequest req) {
        if (req.payloadKind() == PayloadKind.ASSET) {
            return new AssetTransferPayload(
                    req.sourceIdentity().trim(),
                    req.destinationIdentity().trim(),
                    req.tokenId()
            ).encode();
        }
        return req.message().getBytes(StandardCharsets.UTF_8);
    }

    private static long ethToWei(BigDecimal eth) {
        try {
            return eth.multiply(WEI_PER_ETH).toBigIntegerExact().longValueExact();
        } catch (ArithmeticException e) {
            throw new InvalidRequestException("invalid maxFee: must be a decimal with up to 18 fractional digits representing ETH");
        }
    }
}
