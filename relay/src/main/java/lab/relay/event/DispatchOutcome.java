package lab.relay.event;

public enum DispatchOutcome {
    DISPATCHED,
    DUPLICATE,
    REJECTED
}
