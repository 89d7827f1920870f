package lab.relay.sim.fakechain;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

@Component
public class FakeChain {

    public enum NextOutcome {
        SUCCESS,
        TRANSIENT_FAILURE,
        PERMANENT_FAILURE
    }

    // Scripted submission outcomes per transfer, consumed one per submission attempt.
    private final Map<UUID, Queue<NextOutcome>> outcomesByTransfer = new ConcurrentHashMap<>();

    public void enqueueOutcome(UUID transferId, NextOutcome outcome) {
        outcomesByTransfer.computeIfAbsent(transferId, id -> new ConcurrentLinkedQueue<>()).add(outcome);
    }

    public NextOutcome consumeOutcome(UUID transferId) {
        Queue<NextOutcome> queue = outcomesByTransfer.get(transferId);
        if (queue == null) {
            return NextOutcome.SUCCESS;
        }
        NextOutcome next = queue.poll();
        if (queue.isEmpty()) {
            outcomesByTransfer.remove(transferId, queue);
        }
        return next != null ? next : NextOutcome.SUCCESS;
    }

    public int pendingOutcomes(UUID transferId) {
        Queue<NextOutcome> queue = outcomesByTransfer.get(transferId);
        return queue == null ? 0 : queue.size();
    }
}
