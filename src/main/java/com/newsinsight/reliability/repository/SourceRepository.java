package com.newsinsight.reliability.repository;

import com.newsinsight.reliability.entity.Source;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface SourceRepository extends JpaRepository<Source, Long> {

    Optional<Source> findFirstByNameIgnoreCaseOrderByIdAsc(String name);
}
