package com.agentgate.core.policy;

import com.agentgate.api.security.Persona;
import com.agentgate.api.security.ResourceKind;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PolicyStoreTest {

    @Test
    void testMembershipIsExact() {
        PolicyStore store = PolicyStore.builder()
                .allowTables(Persona.FIELD_ENGINEER, "product")
                .build();

        assertTrue(store.isAllowed(Persona.FIELD_ENGINEER, ResourceKind.TABLE, "product"));
        // 大小写敏感
        assertFalse(store.isAllowed(Persona.FIELD_ENGINEER, ResourceKind.TABLE, "PRODUCT"));
        assertFalse(store.isAllowed(Persona.FIELD_ENGINEER, ResourceKind.TABLE, null));
    }

    @Test
    void testOnlyTablesAndToolsHaveAllowSets() {
        PolicyStore store = PolicyStore.builder()
                .allowTables(Persona.FIELD_ENGINEER, "product")
                .allowTools(Persona.FIELD_ENGINEER, "track_shipments")
                .build();

        assertEquals(Set.of("track_shipments"), store.allowedResources(Persona.FIELD_ENGINEER, ResourceKind.OPERATION));
        assertTrue(store.allowedResources(Persona.FIELD_ENGINEER, ResourceKind.QUERY).isEmpty());
        assertTrue(store.allowedResources(Persona.FIELD_ENGINEER, ResourceKind.PERSONA).isEmpty());
    }

    @Test
    void testStoreIsImmutable() {
        PolicyStore store = PolicyStore.builder()
                .allowTables(Persona.FIELD_ENGINEER, "product")
                .rowFilter(Persona.FIELD_ENGINEER, "product", "owner = '{user_id}'")
                .build();

        assertThrows(UnsupportedOperationException.class,
                () -> store.allowedResources(Persona.FIELD_ENGINEER, ResourceKind.TABLE).add("secret"));
        assertThrows(UnsupportedOperationException.class,
                () -> store.rowFilters(Persona.FIELD_ENGINEER).put("x", "y"));
    }

    @Test
    void testExplicitGroupOverridesDefault() {
        PolicyStore store = PolicyStore.builder()
                .group(Persona.PROCUREMENT_SPECIALIST, "buyers")
                .build();

        assertEquals("buyers", store.groupOf(Persona.PROCUREMENT_SPECIALIST));
        assertEquals("warehouse_managers", store.groupOf(Persona.WAREHOUSE_MANAGER));
    }
}
