package com.largomodo.qasmconvert.qasm;

/**
 * A {@code gate name(...) args { ... }} block located in imported text.
 * <p>
 * Only the span is kept: the body is not interpreted, and invoking the gate later in the
 * program is rejected by {@link CommandParser}.
 *
 * @param name   declared gate name
 * @param source the block text, from the {@code gate} keyword through the closing brace
 */
public record CustomGateDefinition(String name, String source) {

    public CustomGateDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Custom gate name must not be null or blank");
        }
        if (source == null) {
            throw new IllegalArgumentException("source must not be null");
        }
    }
}
