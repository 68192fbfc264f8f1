package com.tradejournal.api.controller;

import com.tradejournal.domain.model.BrokerProfile;
import com.tradejournal.exception.BrokerProfileNotFoundException;
import com.tradejournal.service.BrokerProfileRegistry;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for the broker catalog: supported statement sources, their column schemas and export
 * instructions.
 */
@RestController
@RequestMapping("/api/brokers")
public class BrokerController {

    private final BrokerProfileRegistry brokerProfileRegistry;

    public BrokerController(BrokerProfileRegistry brokerProfileRegistry) {
        this.brokerProfileRegistry = brokerProfileRegistry;
    }

    @GetMapping
    public List<String> getBrokers() {
        return brokerProfileRegistry.brokerNames();
    }

    @GetMapping("/{name}")
    public BrokerProfile getBroker(@PathVariable String name) {
        return brokerProfileRegistry
                .find(name)
                .orElseThrow(() -> new BrokerProfileNotFoundException(name, brokerProfileRegistry.brokerNames()));
    }
}
