package com.pgokache.error;

public class RecommendationNotFoundException extends PgOkacheException {
    public RecommendationNotFoundException(long recommendationId) {
        super(ErrorKind.NOT_FOUND, "Recommendation not found: " + recommendationId);
    }
}
