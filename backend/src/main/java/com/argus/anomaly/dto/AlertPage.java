package com.argus.anomaly.dto;

import lombok.Value;

import java.util.List;

@Value
public class AlertPage {
    List<AlertView> alerts;
    Pagination pagination;

    @Value
    public static class Pagination {
        long total;
        int limit;
        int offset;
        boolean hasNextPage;
    }
}
