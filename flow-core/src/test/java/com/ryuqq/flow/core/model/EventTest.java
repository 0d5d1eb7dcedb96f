package com.ryuqq.flow.core.model;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Event, EventMetadata, CostContext 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class EventTest {

    @Test
    void of_GeneratesIdAndTimestamp() {
        Event event = Event.of("order.created", Map.of("orderId", 42));

        assertNotNull(event.id());
        assertTrue(event.timestamp() > 0);
        assertEquals("order.created", event.type());
        assertSame(EventMetadata.empty(), event.metadata());
        assertNull(event.correlationId());
    }

    @Test
    void of_WithCorrelation_ExposesCorrelationId() {
        Event event = Event.of("order.created", null, EventMetadata.withCorrelation("corr-1"));

        assertEquals("corr-1", event.correlationId());
    }

    @Test
    void constructor_BlankType_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Event.of(" ", null));
        assertThrows(IllegalArgumentException.class, () -> new Event(null, "a", null, 0, null));
    }

    @Test
    void constructor_NullMetadata_DefaultsToEmpty() {
        Event event = new Event("e-1", "a", null, 1L, null);

        assertSame(EventMetadata.empty(), event.metadata());
    }

    @Test
    void metadata_WithMethods_KeepOtherFields() {
        CostContext cost = new CostContext();
        EventMetadata metadata = EventMetadata.withCorrelation("corr-1")
            .withTenantId("tenant-a")
            .withCost(cost);

        assertEquals("corr-1", metadata.correlationId());
        assertEquals("tenant-a", metadata.tenantId());
        assertSame(cost, metadata.cost());
        assertEquals(Map.of(), metadata.attributes());
    }

    @Test
    void costContext_CountsRetriesAndTokens() {
        CostContext cost = new CostContext();

        cost.incrementRetries();
        cost.incrementRetries();
        cost.addTokens(120);

        assertEquals(2, cost.getRetries());
        assertEquals(120, cost.getTokens());
        assertThrows(IllegalArgumentException.class, () -> cost.addTokens(-1));
    }
}
