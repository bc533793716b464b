package com.ozone.core.executor;

import com.ozone.core.model.ErrorKind;
import com.ozone.core.model.OrchestrationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lookup of capability providers by capability identifier.
 */
@Component
public class CapabilityRegistry {

    private static final Logger log = LoggerFactory.getLogger(CapabilityRegistry.class);

    private final Map<String, CapabilityProvider> providers = new LinkedHashMap<>();

    public CapabilityRegistry(List<CapabilityProvider> capabilityProviders) {
        for (CapabilityProvider provider : capabilityProviders) {
            String capability = provider.capability();
            CapabilityProvider existing = providers.put(capability, provider);
            if (existing != null) {
                throw new IllegalStateException(
                        "Duplicate capability '" + capability + "': " +
                                existing.getClass().getName() + " and " + provider.getClass().getName());
            }
            log.info("Registered capability: {} -> {}", capability, provider.getClass().getSimpleName());
        }
        log.info("CapabilityRegistry initialized with {} capabilities", providers.size());
    }

    public Optional<CapabilityProvider> lookup(String capability) {
        return Optional.ofNullable(providers.get(capability));
    }

    /**
     * @throws OrchestrationException UNKNOWN_CAPABILITY when no provider serves {@code capability}
     */
    public CapabilityProvider require(String capability) {
        return lookup(capability).orElseThrow(() -> new OrchestrationException(ErrorKind.UNKNOWN_CAPABILITY,
                "No provider registered for capability '" + capability + "'"));
    }

    public boolean supports(String capability) {
        return providers.containsKey(capability);
    }

    public Set<String> capabilities() {
        return Set.copyOf(providers.keySet());
    }
}
