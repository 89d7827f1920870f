package lab.relay.event;

import java.util.function.Consumer;

/**
 * Push-based producer of raw chain events.
 */
public interface EventSource {

    String name();

    Subscription subscribe(Consumer<RawChainEvent> listener);

    @FunctionalInterface
    interface Subscription extends AutoCloseable {

        @Override
        void close();
    }
}
