package lab.relay.adapter;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Allow-list of destination chains, parsed from {@code name:endpointId} pairs.
 */
@Component
public class DestinationChains {

    private final Map<String, Integer> endpointIdsByName;

    public DestinationChains(@Value("${relay.chains.allowed:ethereum:101,polygon:109,arbitrum:110,optimism:111}") String allowed) {
        Map<String, Integer> parsed = new LinkedHashMap<>();
        for (String entry : allowed.split(",")) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int sep = trimmed.lastIndexOf(':');
            if (sep <= 0 || sep == trimmed.length() - 1) {
                throw new IllegalStateException("relay.chains.allowed entry must be name:endpointId, got: " + trimmed);
            }
            String name = normalize(trimmed.substring(0, sep));
            int endpointId = Integer.parseInt(trimmed.substring(sep + 1).trim());
            if (parsed.put(name, endpointId) != null) {
                throw new IllegalStateException("duplicate destination chain: " + name);
            }
        }
        this.endpointIdsByName = Collections.unmodifiableMap(parsed);
    }

    public boolean isAllowed(String chain) {
        return chain != null && endpointIdsByName.containsKey(normalize(chain));
    }

    public Optional<Integer> endpointId(String chain) {
        if (chain == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(endpointIdsByName.get(normalize(chain)));
    }

    public Set<String> names() {
        return endpointIdsByName.keySet();
    }

    public static String normalize(String chain) {
        return chain.trim().toLowerCase(Locale.ROOT);
    }
}
