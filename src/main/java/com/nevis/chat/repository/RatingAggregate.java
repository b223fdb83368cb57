package com.nevis.chat.repository;

/**
 * Feedback ratings attached to one chunk through the citations of rated answers.
 */
public record RatingAggregate(String chunkId, double ratingSum, int ratingCount, int lowCount, int highCount) {

    public double averageRating() {
        return ratingCount == 0 ? 0 : ratingSum / ratingCount;
    }
}
