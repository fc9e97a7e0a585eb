package com.rebalancer.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the leaderboard_snapshots table.
 * Symbols are stored as a comma-separated list in rank order.
 */
@Entity
@Table(name = "leaderboard_snapshots")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LeaderboardSnapshotEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "portfolio_name", length = 100, nullable = false)
    private String portfolioName;

    @Column(name = "index_id", length = 20)
    private String indexId;

    @Column(length = 500)
    private String symbols;

    @Column(name = "captured_at")
    private LocalDateTime capturedAt;
}
