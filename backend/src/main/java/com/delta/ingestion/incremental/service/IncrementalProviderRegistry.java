package com.delta.ingestion.incremental.service;

import com.delta.ingestion.incremental.spi.IncrementalProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class IncrementalProviderRegistry {
    private static final Logger log = LoggerFactory.getLogger(IncrementalProviderRegistry.class);

    private final Map<String, IncrementalProvider> providers = new LinkedHashMap<>();

    public IncrementalProviderRegistry(ObjectProvider<IncrementalProvider> providerBeans) {
        providerBeans.orderedStream().forEach(provider -> {
            String name = provider.getProviderName();
            if (name == null || name.isBlank()) {
                throw new IllegalStateException("Incremental provider without a name: " + provider.getClass().getName());
            }
            IncrementalProvider existing = providers.putIfAbsent(name, provider);
            if (existing != null) {
                throw new IllegalStateException("Duplicate incremental provider name: " + name);
            }
        });
        log.info("Registered {} incremental providers: {}", providers.size(), providers.keySet());
    }

    public Optional<IncrementalProvider> find(String providerName) {
        return Optional.ofNullable(providers.get(providerName));
    }

    public boolean contains(String providerName) {
        return providers.containsKey(providerName);
    }

    public List<String> providerNames() {
        return new ArrayList<>(providers.keySet());
    }
}
