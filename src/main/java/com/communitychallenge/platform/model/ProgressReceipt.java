package com.communitychallenge.platform.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Record of an idempotency key seen for a contributor on a challenge.
 */
@Entity
@Table(name = "challenge_progress_receipts",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_receipt_challenge_contributor_key",
            columnNames = {"challenge_id", "contributor_id", "idempotency_key"})
    },
    indexes = {
        @Index(name = "idx_receipt_received_at", columnList = "received_at")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProgressReceipt {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "receipt_id")
    private Long receiptId;

    @Column(name = "challenge_id", nullable = false)
    private Long challengeId;

    @Column(name = "contributor_id", nullable = false, length = 64)
    private String contributorId;

    @Column(name = "idempotency_key", nullable = false, length = 128)
    private String idempotencyKey;

    @Column(name = "amount", nullable = false)
    private long amount;

    @Column(name = "received_at", nullable = false)
    private Instant receivedAt;
}
