package lab.relay.event;

import java.util.Locale;

/**
 * Deterministic event ids: {@code sourceChain:txId:logIndex}, chain and tx id lower-cased.
 * Any observer of the same chain log derives the same id.
 */
public final class EventIds {

    public static final String SEPARATOR = ":";

    private EventIds() {
    }

    public static String of(String sourceChain, String txId, long logIndex) {
        return sourceChain.trim().toLowerCase(Locale.ROOT)
                + SEPARATOR
                + txId.trim().toLowerCase(Locale.ROOT)
                + SEPARATOR
                + logIndex;
    }
}
