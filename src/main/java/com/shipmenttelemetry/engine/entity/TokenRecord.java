package com.shipmenttelemetry.engine.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * Persistence projection of a token, one row per token id.
 *
 * The payload (metadata and relations) is written on insert and never updated. Re-persisting
 * touches state, version, signature and updated_at only. Rows are never deleted; a shipment's
 * full lineage is a query on root_shipment_id.
 */
@Entity
@Table(
    name = "token_records",
    indexes = {
        @Index(name = "idx_token_root_shipment", columnList = "root_shipment_id"),
        @Index(name = "idx_token_root_type", columnList = "root_shipment_id, token_type")
    }
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TokenRecord {

    @Id
    @Column(name = "token_id", length = 64)
    private String tokenId;

    /**
     * Discriminant code, e.g. "MT-01"
     */
    @Column(name = "token_type", nullable = false, length = 16, updatable = false)
    private String tokenType;

    @Column(nullable = false)
    private Integer version;

    @Column(nullable = false, length = 32)
    private String state;

    /**
     * {"metadata": {...}, "relations": {...}}
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "payload", columnDefinition = "jsonb", nullable = false, updatable = false)
    private String payload;

    @Column(name = "root_shipment_id", nullable = false, length = 64, updatable = false)
    private String rootShipmentId;

    @Column(length = 1024)
    private String signature;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
