package com.folio.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "positions")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    public static final String UNKNOWN_SECTOR = "Unknown";

    @Id
    @Column(length = 32)
    private String ticker;

    @Column(nullable = false)
    private double shares;

    @Column(nullable = false)
    @Builder.Default
    private String sector = UNKNOWN_SECTOR;

    private Double currentPrice;

    private Double marketCap;

    private Instant lastUpdated;

    @PrePersist
    @PreUpdate
    void touch() {
        lastUpdated = Instant.now();
        if (sector == null || sector.isBlank()) {
            sector = UNKNOWN_SECTOR;
        }
    }
}
