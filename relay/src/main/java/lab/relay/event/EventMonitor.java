package lab.relay.event;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Subscribes to event sources and feeds every delivery through the dispatcher.
 * Each source gets one dispatch thread, so events from a source are handled in delivery order and a slow source
 * never stalls another.
 */
@Component
@Slf4j
public class EventMonitor {

    private final RelayEventDispatcher dispatcher;
    private final ObjectProvider<EventSource> sources;
    private final List<ActiveSource> active = new CopyOnWriteArrayList<>();

    public EventMonitor(RelayEventDispatcher dispatcher, ObjectProvider<EventSource> sources) {
        this.dispatcher = dispatcher;
        this.sources = sources;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void subscribeAll() {
        sources.orderedStream().forEach(this::subscribe);
    }

    public void subscribe(EventSource source) {
        ExecutorService loop = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "relay-events-" + source.name());
            t.setDaemon(true);
            return t;
        });
        EventSource.Subscription subscription = source.subscribe(raw -> {
            try {
                loop.execute(() -> dispatchSafely(source, raw));
            } catch (RejectedExecutionException e) {
                log.warn("event=event_monitor.dropped source={} txId={} reason=stopped", source.name(), raw.txId());
            }
        });
        active.add(new ActiveSource(source.name(), subscription, loop));
        log.info("event=event_monitor.subscribed source={}", source.name());
    }

    public int activeSources() {
        return active.size();
    }

    @PreDestroy
    public void close() {
        for (ActiveSource source : active) {
            try {
                source.subscription().close();
            } catch (RuntimeException e) {
                log.warn("event=event_monitor.unsubscribe_failed source={} error={}", source.name(), e.getMessage());
            }
            source.loop().shutdown();
        }
        for (ActiveSource source : active) {
            try {
                if (!source.loop().awaitTermination(5, TimeUnit.SECONDS)) {
                    source.loop().shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                source.loop().shutdownNow();
            }
        }
        active.clear();
    }

    private void dispatchSafely(EventSource source, RawChainEvent raw) {
        try {
            dispatcher.dispatch(raw);
        } catch (RuntimeException e) {
            log.error("event=event_monitor.dispatch_failed source={} txId={} logIndex={} error={}",
                    source.name(), raw.txId(), raw.logIndex(), e.getMessage(), e);
        }
    }

    private record ActiveSource(String name, EventSource.Subscription subscription, ExecutorService loop) {}
}
