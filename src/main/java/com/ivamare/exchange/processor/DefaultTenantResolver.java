package com.ivamare.exchange.processor;

import com.ivamare.exchange.model.Message;

import java.util.Optional;

/**
 * Uses the configured tenant when set, otherwise the tenant of the message's
 * entity reference.
 */
public class DefaultTenantResolver implements TenantResolver {

    private final String configuredTenantId;

    public DefaultTenantResolver(String configuredTenantId) {
        this.configuredTenantId = configuredTenantId;
    }

    @Override
    public Optional<String> resolve(Message message) {
        if (configuredTenantId != null && !configuredTenantId.isBlank()) {
            return Optional.of(configuredTenantId);
        }
        return message.getTenantId().filter(tenant -> !tenant.isBlank());
    }
}
