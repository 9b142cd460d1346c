package com.socialfusion.domain.model;

import java.util.List;

/**
 * One assembled timeline page with the per-reason tally of the filter pass that produced it.
 */
public record Page<T>(
    List<T> data,
    int considered,
    int filteredOut
) {
    public static <T> Page<T> of(List<T> data, int considered) {
        return new Page<>(data, considered, considered - data.size());
    }

    public static <T> Page<T> empty() {
        return new Page<>(List.of(), 0, 0);
    }
}
