package lab.relay.orchestration;

import jakarta.annotation.PostConstruct;
import lab.relay.event.RelayEventDispatcher;
import lab.relay.event.RelayEventKind;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Routes authenticated TransferCompleted/TransferFailed events to the orchestrator.
 */
@Component
@RequiredArgsConstructor
public class TransferConfirmationHandler {

    private final RelayEventDispatcher dispatcher;
    private final TransferOrchestrator orchestrator;

    @PostConstruct
    void register() {
        dispatcher.subscribe(RelayEventKind.TRANSFER_COMPLETED, orchestrator::onConfirmationEvent);
        dispatcher.subscribe(RelayEventKind.TRANSFER_FAILED, orchestrator::onConfirmationEvent);
    }
}
