package com.socialfusion.adapter.in.web;

import com.socialfusion.domain.model.Page;

import java.util.List;
import java.util.function.Function;

public record PageResponse<T>(
    List<T> data,
    Summary summary
) {
    public static <S, T> PageResponse<T> from(Page<S> page, Function<S, T> mapper) {
        if (page == null) {
            return new PageResponse<>(List.of(), new Summary(0, 0, 0));
        }
        List<T> data = page.data().stream().map(mapper).toList();
        return new PageResponse<>(data, new Summary(page.considered(), data.size(), page.filteredOut()));
    }

    /**
     * How many merged posts the filter looked at and how many it hid.
     */
    public record Summary(
        int considered,
        int shown,
        int filteredOut
    ) {}
}
