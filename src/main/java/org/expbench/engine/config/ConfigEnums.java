package org.expbench.engine.config;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

final class ConfigEnums {

    private ConfigEnums() {
    }

    static <E extends Enum<E>> E parse(Class<E> type, String key, String what) {
        if (key == null || key.isBlank()) {
            throw new ConfigException("Missing " + what);
        }
        String normalized = key.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return Enum.valueOf(type, normalized);
        } catch (IllegalArgumentException e) {
            String allowed = Arrays.stream(type.getEnumConstants())
                    .map(c -> c.name().toLowerCase(Locale.ROOT))
                    .collect(Collectors.joining(", "));
            throw new ConfigException("Unknown " + what + ": " + key + " (expected one of " + allowed + ")", e);
        }
    }
}
