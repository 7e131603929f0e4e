package com.fragrance.enrichment.store;

import com.fragrance.enrichment.model.RegulatoryRecord;

import java.util.Optional;

/**
 * Regulatory standards table, unique per (CAS number, owner).
 */
public interface RegulatoryStore {

    Optional<RegulatoryRecord> findByRegistry(String casNumber, String owner);

    /**
     * Inserts or replaces the row for the record's (CAS number, owner).
     *
     * @return {@code true} when a new row was created
     */
    boolean upsert(RegulatoryRecord record);

    long countByOwner(String owner);
}
