package com.largomodo.qasmconvert.qasm;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Statement text left after comments, header directives and custom gate blocks are removed.
 *
 * @param body        remaining statements, still {@code ;} separated
 * @param customGates custom gate blocks in source order (unmodifiable)
 */
public record PreprocessedProgram(String body, List<CustomGateDefinition> customGates) {

    public PreprocessedProgram {
        if (body == null) {
            throw new IllegalArgumentException("body must not be null");
        }
        customGates = customGates == null ? List.of() : List.copyOf(customGates);
    }

    /**
     * @return names of the custom gates, lower-cased
     */
    public Set<String> customGateNames() {
        return customGates.stream()
                .map(definition -> definition.name().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
