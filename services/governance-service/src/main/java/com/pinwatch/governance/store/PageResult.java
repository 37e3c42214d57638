package com.pinwatch.governance.store;

import java.util.List;
import java.util.function.Function;

/**
 * One page of a query. {@code limit} is the effective, clamped limit, not the requested one.
 */
public record PageResult<T>(List<T> items, int count, int limit, long offset, long total) {

    public PageResult {
        items = List.copyOf(items);
    }

    public static <T> PageResult<T> of(List<T> items, int limit, long offset, long total) {
        return new PageResult<>(items, items.size(), limit, offset, total);
    }

    public <R> PageResult<R> map(Function<? super T, ? extends R> mapper) {
        List<R> mapped = items.stream().<R>map(mapper).toList();
        return new PageResult<>(mapped, count, limit, offset, total);
    }
}
