package com.newsinsight.reliability.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * A rated publication venue.
 * Maintained by ingestion; this service only fills in an estimated impact metric when none is known.
 */
@Entity
@Table(name = "sources", uniqueConstraints = {
    @UniqueConstraint(name = "uq_sources_name", columnNames = "name")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Source {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "issn", length = 32)
    private String issn;

    @Column(name = "category", length = 100)
    private String category;

    @Column(name = "publisher", length = 255)
    private String publisher;

    /**
     * Traditional impact metric (e.g. impact factor). Reference only, never a scoring input.
     */
    @Column(name = "reference_impact_metric")
    private Double referenceImpactMetric;

    @Column(name = "impact_metric_estimated", nullable = false)
    @Builder.Default
    private Boolean impactMetricEstimated = false;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
