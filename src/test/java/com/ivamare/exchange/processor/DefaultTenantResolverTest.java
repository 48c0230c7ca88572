package com.ivamare.exchange.processor;

import com.ivamare.exchange.model.EntityReference;
import com.ivamare.exchange.model.Message;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DefaultTenantResolver")
class DefaultTenantResolverTest {

    private final Message withTenant = Message.builder()
        .entityReference(EntityReference.of("ORD-1", "order", "erp", "acme"))
        .build();

    @Test
    @DisplayName("should prefer configured tenant")
    void shouldPreferConfiguredTenant() {
        assertEquals(Optional.of("globex"), new DefaultTenantResolver("globex").resolve(withTenant));
    }

    @Test
    @DisplayName("should fall back to entity reference tenant")
    void shouldFallBackToEntityReference() {
        assertEquals(Optional.of("acme"), new DefaultTenantResolver(" ").resolve(withTenant));
        assertEquals(Optional.of("acme"), new DefaultTenantResolver(null).resolve(withTenant));
    }

    @Test
    @DisplayName("should resolve nothing without any tenant")
    void shouldResolveNothing() {
        Message bare = Message.builder().build();
        Message blank = Message.builder().entityReference(EntityReference.of("ORD-1", "order", "erp", "")).build();

        assertTrue(new DefaultTenantResolver(null).resolve(bare).isEmpty());
        assertTrue(new DefaultTenantResolver(null).resolve(blank).isEmpty());
    }
}
