package com.chicu.signalbot.scan;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Все известные стратегии, включая выключенные (без канала),
 * чтобы командам было что показать в "Disabled strategies".
 */
public class StrategyCatalog {

    private final Map<String, ScanStrategy> strategies = new LinkedHashMap<>();

    public StrategyCatalog(Collection<ScanStrategy> all) {
        for (ScanStrategy s : all) {
            strategies.put(s.getId().toLowerCase(Locale.ROOT), s);
        }
    }

    public Optional<ScanStrategy> find(String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(strategies.get(id.trim().toLowerCase(Locale.ROOT)));
    }

    public boolean isKnown(String id) {
        return find(id).isPresent();
    }

    public Collection<ScanStrategy> all() {
        return Collections.unmodifiableCollection(strategies.values());
    }

    public List<ScanStrategy> enabled() {
        return strategies.values().stream().filter(ScanStrategy::isEnabled).toList();
    }

    public List<String> disabledIds() {
        return strategies.values().stream()
                .filter(s -> !s.isEnabled())
                .map(ScanStrategy::getId)
                .toList();
    }
}
