package com.ivamare.exchange.processor;

import com.ivamare.exchange.model.Message;

import java.util.Optional;

/**
 * Determines the tenant a message is processed for.
 */
@FunctionalInterface
public interface TenantResolver {

    Optional<String> resolve(Message message);
}
