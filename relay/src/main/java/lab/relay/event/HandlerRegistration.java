package lab.relay.event;

@FunctionalInterface
public interface HandlerRegistration {

    void unsubscribe();
}
