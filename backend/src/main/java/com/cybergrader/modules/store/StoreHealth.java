package com.cybergrader.modules.store;

/**
 * @param backend      configured backend name
 * @param persistent   whether the backend is durable
 * @param enabled      whether durable writes are currently attempted
 * @param failedWrites durable writes that failed after the in-memory write succeeded
 */
public record StoreHealth(String backend, boolean persistent, boolean enabled, long failedWrites) {}
