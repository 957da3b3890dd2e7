package com.bank.dispute.model;

import java.util.List;

public record PagedResponse<T>(List<T> data, boolean hasMore, String nextCursor) {

    public static <T> PagedResponse<T> empty() {
        return new PagedResponse<>(List.of(), false, null);
    }
}
