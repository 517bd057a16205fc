package com.newsinsight.reliability.repository;

import com.newsinsight.reliability.entity.EvidenceItem;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface EvidenceItemRepository extends JpaRepository<EvidenceItem, Long> {

    /**
     * Evidence whose source name and domain contain the given fragments, case-insensitive.
     * Ordered by id so repeated runs see the same evidence subset.
     */
    @Query("SELECT e FROM EvidenceItem e " +
           "WHERE LOWER(e.sourceName) LIKE LOWER(CONCAT('%', :sourceName, '%')) " +
           "AND LOWER(e.domain) LIKE LOWER(CONCAT('%', :domain, '%')) " +
           "ORDER BY e.id ASC")
    List<EvidenceItem> findBySourceAndDomain(@Param("sourceName") String sourceName,
                                             @Param("domain") String domain,
                                             Pageable pageable);

    /**
     * Sources with at least one evidence item whose domain contains the given fragment.
     */
    @Query("SELECT DISTINCT e.sourceName FROM EvidenceItem e " +
           "WHERE LOWER(e.domain) LIKE LOWER(CONCAT('%', :domain, '%')) " +
           "ORDER BY e.sourceName")
    List<String> findDistinctSourceNamesByDomain(@Param("domain") String domain);

    @Query("SELECT DISTINCT LOWER(e.domain) FROM EvidenceItem e ORDER BY LOWER(e.domain)")
    List<String> findDistinctDomains();
}
