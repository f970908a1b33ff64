package com.futures.monitor.service;

import com.futures.monitor.api.ExchangeGateway;
import com.futures.monitor.config.MonitorConfig;

/**
 * Builds a gateway bound to one credential pair.
 */
@FunctionalInterface
public interface GatewayFactory {
    ExchangeGateway create(MonitorConfig config);
}
