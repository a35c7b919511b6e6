package com.pgokache.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RecommendationType {
    MISSING_INDEX("missing_index", true),
    WORK_MEM("work_mem", true),
    READ_REPLICA("read_replica", false);

    private final String code;
    private final boolean perQuery;

    RecommendationType(String code, boolean perQuery) {
        this.code = code;
        this.perQuery = perQuery;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Whether recommendations of this type are keyed by query id as well as instance.
     *
     * @return true for per-query types
     */
    public boolean isPerQuery() {
        return perQuery;
    }
}
