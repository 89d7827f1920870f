package lab.relay.orchestration;

import lab.relay.domain.transfer.TransferRequest;
import lab.relay.sim.fakechain.FakeChain;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
@RequestMapping("/sim")
@ConditionalOnProperty(prefix = "relay.chain", name = "mode", havingValue = "mock", matchIfMissing = true)
public class SimController {

    private final TransferOrchestrator orchestrator;
    private final FakeChain fakeChain;

    // Queue a scripted outcome for the next submission attempt of a transfer; repeat to script several attempts.
    @PostMapping("/transfers/{id}/next-outcome/{outcome}")
    public Map<String, Object> enqueueOutcome(@PathVariable UUID id, @PathVariable FakeChain.NextOutcome outcome) {
        fakeChain.enqueueOutcome(id, outcome);
        return Map.of("transferId", id, "queued", fakeChain.pendingOutcomes(id));
    }

    // Stand-in for the destination chain's confirmation, which mock mode never produces on its own.
    @PostMapping("/transfers/{id}/confirm")
    public TransferStatusResponse confirm(@PathVariable UUID id, @RequestParam(defaultValue = "true") boolean success) {
        TransferRequest current = orchestrator.getStatus(id);
        if (!orchestrator.applyConfirmation(id, success, "simulated confirmation")) {
            throw new IllegalTransferStateException(id, current.getState(), "confirm");
        }
        return TransferStatusResponse.from(orchestrator.getStatus(id));
    }
}
