package quest.gekko.giveaway.domain;

import java.util.Locale;
import java.util.Optional;

public enum ClientRole {
    OVERLAY,
    CONTROLS,
    RESULTS;

    public static Optional<ClientRole> fromWire(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
