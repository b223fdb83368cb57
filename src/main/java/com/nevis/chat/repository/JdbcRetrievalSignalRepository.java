package com.nevis.chat.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
@RequiredArgsConstructor
public class JdbcRetrievalSignalRepository implements RetrievalSignalRepository {

    private final JdbcClient jdbcClient;

    @Override
    public List<RetrievalSignal> findAll() {
        return jdbcClient.sql("SELECT * FROM retrieval_signals")
            .query((rs, rowNum) -> new RetrievalSignal(
                rs.getString("chunk_id"),
                rs.getDouble("multiplier"),
                rs.getDouble("avg_rating"),
                rs.getInt("rating_count"),
                rs.getInt("low_count"),
                rs.getInt("high_count")
            ))
            .list();
    }

    /**
     * Message ratings reach a chunk through the citations of the rated answer; thread ratings
     * reach every chunk cited anywhere in the rated thread.
     */
    @Override
    public List<RatingAggregate> aggregateRatings(Collection<String> chunkIds) {
        if (chunkIds.isEmpty()) {
            return List.of();
        }

        String sql = """
            WITH ratings AS (
                SELECT mc.chunk_id, mf.rating
                FROM message_citations mc
                JOIN message_feedback mf ON mf.message_id = mc.message_id
                WHERE mc.chunk_id IN (:chunkIds)
                UNION ALL
                SELECT cited.chunk_id, tf.rating
                FROM (
                    SELECT DISTINCT m.thread_id, mc.chunk_id
                    FROM message_citations mc
                    JOIN messages m ON m.id = mc.message_id
                    WHERE mc.chunk_id IN (:chunkIds)
                ) cited
                JOIN thread_feedback tf ON tf.thread_id = cited.thread_id
            )
            SELECT chunk_id,
                   SUM(rating) AS rating_sum,
                   COUNT(*) AS rating_count,
                   COUNT(*) FILTER (WHERE rating <= 2) AS low_count,
                   COUNT(*) FILTER (WHERE rating >= 4) AS high_count
            FROM ratings
            GROUP BY chunk_id
            """;

        return jdbcClient.sql(sql)
            .param("chunkIds", chunkIds)
            .query((rs, rowNum) -> new RatingAggregate(
                rs.getString("chunk_id"),
                rs.getDouble("rating_sum"),
                rs.getInt("rating_count"),
                rs.getInt("low_count"),
                rs.getInt("high_count")
            ))
            .list();
    }

    @Override
    public List<String> findCitedChunkIds() {
        return jdbcClient.sql("SELECT DISTINCT chunk_id FROM message_citations ORDER BY chunk_id")
            .query(String.class)
            .list();
    }

    @Override
    public void upsert(RetrievalSignal signal) {
        jdbcClient.sql("""
                INSERT INTO retrieval_signals (chunk_id, multiplier, avg_rating, rating_count, low_count, high_count)
                VALUES (:chunkId, :multiplier, :avgRating, :ratingCount, :lowCount, :highCount)
                ON CONFLICT (chunk_id) DO UPDATE
                SET multiplier = EXCLUDED.multiplier,
                    avg_rating = EXCLUDED.avg_rating,
                    rating_count = EXCLUDED.rating_count,
                    low_count = EXCLUDED.low_count,
                    high_count = EXCLUDED.high_count,
                    updated_at = NOW()
                """)
            .param("chunkId", signal.chunkId())
            .param("multiplier", signal.multiplier())
            .param("avgRating", signal.avgRating())
            .param("ratingCount", signal.ratingCount())
            .param("lowCount", signal.lowCount())
            .param("highCount", signal.highCount())
            .update();
    }

    @Override
    public void delete(String chunkId) {
        jdbcClient.sql("DELETE FROM retrieval_signals WHERE chunk_id = :chunkId")
            .param("chunkId", chunkId)
            .update();
    }
}
