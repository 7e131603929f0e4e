package com.fragrance.enrichment.store;

import com.fragrance.enrichment.model.CategoryLimit;
import com.fragrance.enrichment.model.RegulatoryCategory;
import com.fragrance.enrichment.model.RegulatoryRecord;
import com.fragrance.enrichment.support.H2Stores;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JdbcRegulatoryStoreTest {

    private H2Stores stores;
    private JdbcRegulatoryStore store;

    @BeforeEach
    void setUp() {
        stores = new H2Stores();
        store = stores.getRegulatory();
    }

    @AfterEach
    void tearDown() {
        stores.close();
    }

    private static RegulatoryRecord citral(String owner, double cat1) {
        return RegulatoryRecord.builder()
                .casNumber("5392-40-5")
                .owner(owner)
                .name("Citral")
                .amendment("49")
                .restrictionType("Restriction")
                .limits(RegulatoryCategory.complete(Map.of(RegulatoryCategory.CAT1, CategoryLimit.of(cat1),
                        RegulatoryCategory.CAT2, CategoryLimit.prohibitedLimit())))
                .build();
    }

    @Test
    @DisplayName("Should insert, then replace the row for the same CAS number and owner")
    void testUpsert() {
        assertTrue(store.upsert(citral("1", 0.1)));
        assertFalse(store.upsert(citral("1", 0.05)));

        RegulatoryRecord r = store.findByRegistry("5392-40-5", "1").orElseThrow();
        assertEquals(0.05, r.limit(RegulatoryCategory.CAT1).percent(), 1e-9);
        assertTrue(r.limit(RegulatoryCategory.CAT2).prohibited());
        assertTrue(r.limit(RegulatoryCategory.CAT3).isUnrestricted());
        assertEquals("Restriction", r.getRestrictionType());
        assertEquals(1, store.countByOwner("1"));
    }

    @Test
    @DisplayName("Should keep owners apart")
    void testOwnerScope() {
        store.upsert(citral("1", 0.1));

        assertTrue(store.findByRegistry("5392-40-5", "2").isEmpty());
        assertTrue(store.upsert(citral("2", 0.3)));
        assertEquals(1, store.countByOwner("2"));
        assertEquals(0.1, store.findByRegistry(" 5392-40-5 ", "1").orElseThrow()
                .limit(RegulatoryCategory.CAT1).percent(), 1e-9);
    }
}
