package lab.relay.orchestration;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
@RequestMapping("/transfers")
@Slf4j
public class TransferController {

    private final TransferOrchestrator orchestrator;

    // Accepted transfers are driven in the background; poll GET /transfers/{id} for progress.
    @PostMapping
    public ResponseEntity<SubmitOutcome> submit(@RequestBody CreateTransferRequest req) {
        log.info(
                "event=transfer.submit.request sourceIdentity={} destinationChain={} payloadKind={} maxFee={}",
                req.sourceIdentity(),
                req.destinationChain(),
                req.payloadKind(),
                req.maxFee()
        );
        SubmitOutcome outcome = orchestrator.submit(req);
        HttpStatus status = switch (outcome.status()) {
            case ACCEPTED -> HttpStatus.ACCEPTED;
            case RATE_LIMITED -> HttpStatus.TOO_MANY_REQUESTS;
            case INVALID -> HttpStatus.BAD_REQUEST;
        };
        log.info("event=transfer.submit.response status={} transferId={}", outcome.status(), outcome.requestId());
        return ResponseEntity.status(status).body(outcome);
    }

    @GetMapping("/{id}")
    public ResponseEntity<TransferStatusResponse> get(@PathVariable UUID id) {
        return ResponseEntity.ok(TransferStatusResponse.from(orchestrator.getStatus(id)));
    }

    @GetMapping
    public ResponseEntity<List<TransferStatusResponse>> listBySource(@RequestParam String sourceIdentity) {
        List<TransferStatusResponse> transfers = orchestrator.listBySource(sourceIdentity).stream()
                .map(TransferStatusResponse::from)
                .toList();
        return ResponseEntity.ok(transfers);
    }

    // Synchronous drive for operators and for deployments running with auto-drive disabled.
    @PostMapping("/{id}/drive")
    public ResponseEntity<TransferStatusResponse> drive(@PathVariable UUID id) {
        log.info("event=transfer.drive.request transferId={}", id);
        return ResponseEntity.ok(TransferStatusResponse.from(orchestrator.drive(id)));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<TransferStatusResponse> cancel(@PathVariable UUID id) {
        log.info("event=transfer.cancel.request transferId={}", id);
        return ResponseEntity.ok(TransferStatusResponse.from(orchestrator.cancel(id)));
    }
}
