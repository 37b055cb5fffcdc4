package org.dxworks.docframe;

import java.util.Locale;
import java.util.Optional;

/** Which extraction path produces the category map. */
public enum RoutingMode {
    WAREHOUSE,
    LEGACY;

    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<RoutingMode> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        for (RoutingMode mode : values()) {
            if (mode.name().equalsIgnoreCase(value.trim())) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
