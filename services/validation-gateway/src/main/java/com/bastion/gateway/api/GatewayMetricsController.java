package com.bastion.gateway.api;

import com.bastion.validation.GatewayMetricsSnapshot;
import com.bastion.validation.ValidationGateway;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Point-in-time counters of the gateway: cache effectiveness, audit delivery, translation
 * coverage and credential extensions.
 */
@RestController
@RequestMapping("/api/v1/gateway")
public class GatewayMetricsController {

    private final ValidationGateway gateway;

    public GatewayMetricsController(ValidationGateway gateway) {
        this.gateway = gateway;
    }

    @GetMapping("/metrics")
    public Map<String, Object> metrics() {
        GatewayMetricsSnapshot snapshot = gateway.metricsSnapshot();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("requestsProcessed", snapshot.requestsProcessed());
        body.put("parallelEnabled", snapshot.parallelEnabled());
        body.put("selectionPolicy", snapshot.selectionPolicy());
        body.put("cache", snapshot.cache());
        body.put("cacheHitRatePercent", snapshot.cache().hitRatePercent());
        body.put("translation", snapshot.translation());
        body.put("translationMappedPercent", snapshot.translation().mappedPercent());
        body.put("audit", snapshot.audit());
        body.put("extensions", snapshot.extensions());
        body.put("extensionSuccessPercent", snapshot.extensions().successPercent());
        return body;
    }
}
