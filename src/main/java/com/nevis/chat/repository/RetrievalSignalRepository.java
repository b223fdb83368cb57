package com.nevis.chat.repository;

import java.util.Collection;
import java.util.List;

public interface RetrievalSignalRepository {

    List<RetrievalSignal> findAll();

    List<RatingAggregate> aggregateRatings(Collection<String> chunkIds);

    List<String> findCitedChunkIds();

    void upsert(RetrievalSignal signal);

    void delete(String chunkId);
}
