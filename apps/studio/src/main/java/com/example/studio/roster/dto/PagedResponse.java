package com.example.studio.roster.dto;

import java.util.List;

/**
 * One page of rows plus the total number of rows visible to the caller.
 */
public record PagedResponse<T>(
        List<T> data,
        long total
) {
    public PagedResponse {
        data = data != null ? List.copyOf(data) : List.of();
    }

    public static <T> PagedResponse<T> empty() {
        return new PagedResponse<>(List.of(), 0);
    }
}
