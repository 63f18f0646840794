package com.shipmenttelemetry.engine.repository;

import com.shipmenttelemetry.engine.entity.TokenRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TokenRecordRepository extends JpaRepository<TokenRecord, String> {

    /**
     * Full lineage of a shipment, served by the root_shipment_id index.
     */
    List<TokenRecord> findByRootShipmentIdOrderByCreatedAtAscTokenIdAsc(String rootShipmentId);

    List<TokenRecord> findByRootShipmentIdAndTokenTypeOrderByCreatedAtAscTokenIdAsc(String rootShipmentId,
                                                                                   String tokenType);
}
