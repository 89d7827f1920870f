package lab.relay.event;

import lab.relay.auth.SignatureAuthorizationVerifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class EventConfig {

    @Bean
    public EventDedupSet eventDedupSet(
            @Value("${relay.events.dedup-ttl:24h}") Duration ttl,
            @Value("${relay.events.dedup-max-entries:100000}") int maxEntries,
            Clock clock) {
        return new EventDedupSet(ttl, maxEntries, clock);
    }

    @Bean
    public RelayEventDispatcher relayEventDispatcher(
            EventDedupSet eventDedupSet,
            SignatureAuthorizationVerifier signatureAuthorizationVerifier,
            @Value("${relay.events.required-role:ADMIN}") String requiredRole,
            Clock clock) {
        return new RelayEventDispatcher(eventDedupSet, signatureAuthorizationVerifier, requiredRole, clock);
    }
}
