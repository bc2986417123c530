package com.portray.portal.common.outbox;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface OutboxEventRepository extends JpaRepository<OutboxEvent, String> {

    /**
     * Oldest undelivered events of one aggregate type that have not used up their attempts.
     */
    @Query(value = "SELECT * FROM outbox_events WHERE processed_at IS NULL AND aggregate_type = :aggregateType "
            + "AND attempts < :maxAttempts ORDER BY created_at ASC LIMIT :limit", nativeQuery = true)
    List<OutboxEvent> findDeliverable(@Param("aggregateType") String aggregateType,
                                      @Param("maxAttempts") int maxAttempts,
                                      @Param("limit") int limit);
}
