package com.delta.ingestion.incremental.service;

import com.delta.ingestion.incremental.spi.IncrementalProvider;
import com.delta.ingestion.incremental.spi.IngestionContext;
import com.delta.ingestion.incremental.spi.ProviderPage;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.support.DefaultListableBeanFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IncrementalProviderRegistryTest {

    @Test
    void providersAreLookedUpByName() {
        DefaultListableBeanFactory beans = new DefaultListableBeanFactory();
        beans.registerSingleton("alpha", provider("alpha"));
        beans.registerSingleton("beta", provider("beta"));

        IncrementalProviderRegistry registry = new IncrementalProviderRegistry(beans.getBeanProvider(IncrementalProvider.class));

        assertTrue(registry.contains("alpha"));
        assertFalse(registry.contains("gamma"));
        assertThat(registry.find("beta")).isPresent();
        assertThat(registry.providerNames()).containsExactlyInAnyOrder("alpha", "beta");
    }

    @Test
    void duplicateNamesAreRejected() {
        DefaultListableBeanFactory beans = new DefaultListableBeanFactory();
        beans.registerSingleton("first", provider("same"));
        beans.registerSingleton("second", provider("same"));

        assertThrows(
            IllegalStateException.class,
            () -> new IncrementalProviderRegistry(beans.getBeanProvider(IncrementalProvider.class))
        );
    }

    private static IncrementalProvider provider(String name) {
        return new IncrementalProvider() {
            @Override
            public String getProviderName() {
                return name;
            }

            @Override
            public ProviderPage next(IngestionContext context) {
                return ProviderPage.last(null);
            }
        };
    }
}
