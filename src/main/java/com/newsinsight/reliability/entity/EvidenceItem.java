package com.newsinsight.reliability.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * One published work attributed to a source.
 *
 * The source is referenced by name only; the venue may not exist in {@code sources} yet.
 * Publication dates are kept as delivered by the literature database ("2023", "2023-05", "2023 May 12").
 */
@Entity
@Table(name = "evidence_items", indexes = {
    @Index(name = "idx_evidence_source_name", columnList = "source_name"),
    @Index(name = "idx_evidence_domain", columnList = "domain")
}, uniqueConstraints = {
    @UniqueConstraint(name = "uq_evidence_external_id", columnNames = "external_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvidenceItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "external_id", nullable = false, length = 64)
    private String externalId;

    @Column(name = "source_name", nullable = false, length = 255)
    private String sourceName;

    @Column(name = "domain", nullable = false, length = 100)
    private String domain;

    @Column(name = "publication_date", length = 32)
    private String publicationDate;

    @Column(name = "title", nullable = false, columnDefinition = "TEXT")
    private String title;

    @Column(name = "abstract_text", columnDefinition = "TEXT")
    private String abstractText;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;
}
