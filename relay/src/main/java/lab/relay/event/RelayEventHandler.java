package lab.relay.event;

@FunctionalInterface
public interface RelayEventHandler {

    // Runs on the dispatch thread; keep it short and hand long work off elsewhere.
    void handle(RelayEvent event);
}
