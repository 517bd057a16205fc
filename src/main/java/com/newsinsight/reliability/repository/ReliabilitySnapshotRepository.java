package com.newsinsight.reliability.repository;

import com.newsinsight.reliability.entity.ReliabilitySnapshot;
import com.newsinsight.reliability.entity.UseCase;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface ReliabilitySnapshotRepository extends JpaRepository<ReliabilitySnapshot, Long> {

    @Query("SELECT s FROM ReliabilitySnapshot s " +
           "WHERE s.source.id = :sourceId AND s.domain = :domain " +
           "AND s.useCase = :useCase AND s.snapshotDate = :date")
    Optional<ReliabilitySnapshot> findByKey(@Param("sourceId") Long sourceId,
                                            @Param("domain") String domain,
                                            @Param("useCase") UseCase useCase,
                                            @Param("date") LocalDate date);

    /**
     * Ranked rows for one date, best score first; ties broken by id.
     */
    @Query("SELECT s FROM ReliabilitySnapshot s JOIN FETCH s.source " +
           "WHERE s.domain = :domain AND s.useCase = :useCase AND s.snapshotDate = :date " +
           "ORDER BY s.score DESC, s.id ASC")
    List<ReliabilitySnapshot> findRanked(@Param("domain") String domain,
                                         @Param("useCase") UseCase useCase,
                                         @Param("date") LocalDate date,
                                         Pageable pageable);

    /**
     * Latest snapshot date on or before the given date.
     */
    @Query("SELECT MAX(s.snapshotDate) FROM ReliabilitySnapshot s " +
           "WHERE s.domain = :domain AND s.useCase = :useCase AND s.snapshotDate <= :date")
    Optional<LocalDate> findLatestDateOnOrBefore(@Param("domain") String domain,
                                                 @Param("useCase") UseCase useCase,
                                                 @Param("date") LocalDate date);

    @Query("SELECT DISTINCT s.domain FROM ReliabilitySnapshot s WHERE s.useCase = :useCase ORDER BY s.domain")
    List<String> findDistinctDomains(@Param("useCase") UseCase useCase);

    @Query("SELECT COUNT(s) AS sourceCount, AVG(s.score) AS avgScore, MAX(s.score) AS topScore " +
           "FROM ReliabilitySnapshot s " +
           "WHERE s.domain = :domain AND s.useCase = :useCase AND s.snapshotDate = :date")
    SnapshotStats aggregate(@Param("domain") String domain,
                            @Param("useCase") UseCase useCase,
                            @Param("date") LocalDate date);

    @Query("SELECT COUNT(s) FROM ReliabilitySnapshot s " +
           "WHERE s.source.id = :sourceId AND s.domain = :domain " +
           "AND s.useCase = :useCase AND s.snapshotDate = :date")
    long countByKey(@Param("sourceId") Long sourceId,
                    @Param("domain") String domain,
                    @Param("useCase") UseCase useCase,
                    @Param("date") LocalDate date);

    interface SnapshotStats {
        Long getSourceCount();

        Double getAvgScore();

        Double getTopScore();
    }
}
