package com.nilsson.promptsyntax.model;

import java.util.List;
import java.util.Objects;

final class Nodes {

    private Nodes() {
    }

    /** Null-safe for immutable lists, whose {@code contains(null)} throws. */
    static boolean hasNull(List<?> list) {
        return list.stream().anyMatch(Objects::isNull);
    }
}
