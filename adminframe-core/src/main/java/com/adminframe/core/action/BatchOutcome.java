package com.adminframe.core.action;

import java.util.ArrayList;
import java.util.List;

/**
 * 一批对象的执行结果
 */
public record BatchOutcome(int affected, int skipped, List<String> errors) {

    public BatchOutcome {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static BatchOutcome empty() {
        return new BatchOutcome(0, 0, List.of());
    }

    public BatchOutcome merge(BatchOutcome other) {
        List<String> merged = new ArrayList<>(errors);
        merged.addAll(other.errors);
        return new BatchOutcome(affected + other.affected, skipped + other.skipped, merged);
    }
}
