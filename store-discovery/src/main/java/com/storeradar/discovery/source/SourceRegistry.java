package com.storeradar.discovery.source;

import com.storeradar.discovery.config.RunSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Every adapter bean, in priority order (cheapest tier first, then name).
 */
@Component
@Slf4j
public class SourceRegistry {

    private final Map<String, SourceAdapter> adapters = new LinkedHashMap<>();

    public SourceRegistry(List<SourceAdapter> adapters) {
        adapters.stream()
                .sorted(Comparator.comparing(SourceAdapter::tier).thenComparing(SourceAdapter::name))
                .forEach(a -> {
                    if (this.adapters.putIfAbsent(a.name(), a) != null) {
                        throw new IllegalStateException("Duplicate source adapter name: " + a.name());
                    }
                });
        log.info("Registered {} source adapters: {}", this.adapters.size(), this.adapters.keySet());
    }

    public List<SourceAdapter> all() {
        return List.copyOf(adapters.values());
    }

    public Optional<SourceAdapter> find(String name) {
        return Optional.ofNullable(adapters.get(name));
    }

    /**
     * Adapters that take part in a run with these settings. Unconfigured adapters stay in
     * the list; the run reports them as skipped.
     */
    public List<SourceAdapter> select(RunSettings settings) {
        return adapters.values().stream()
                .filter(a -> settings.includes(a.name(), a.tier()))
                .toList();
    }
}
