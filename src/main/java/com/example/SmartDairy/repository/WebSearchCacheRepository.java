package com.example.SmartDairy.repository;

import com.example.SmartDairy.model.WebSearchCacheEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Repository
public interface WebSearchCacheRepository extends JpaRepository<WebSearchCacheEntry, Long> {

    Optional<WebSearchCacheEntry> findByQuery(String query);

    /**
     * Single-statement increment, so concurrent cache hits never lose a count.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("update WebSearchCacheEntry e set e.hitCount = e.hitCount + 1 where e.query = :query")
    int incrementHitCount(@Param("query") String query);
}
