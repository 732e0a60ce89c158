package com.code.quality.analyzer;

import com.code.quality.core.Digests;
import com.code.quality.core.model.IssueCategory;
import com.code.quality.core.model.ParsedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Registry of analyzer units, owned by one orchestrator.
 * Indexes units by category, language and priority, and builds ordered execution plans.
 *
 * <p>Registering a unit under a name that is already taken replaces the previous
 * registration (last registration wins). This supports re-registering a unit with new
 * configuration at runtime and is logged at WARN.</p>
 */
public class AnalyzerRegistry {
    private static final Logger log = LoggerFactory.getLogger(AnalyzerRegistry.class);

    private final ConcurrentMap<String, Registration> registrations = new ConcurrentHashMap<>();

    /**
     * Registers a unit with {@link AnalyzerPriority#MEDIUM}.
     */
    public void register(AnalyzerUnit unit) {
        register(unit, AnalyzerPriority.MEDIUM);
    }

    /**
     * Registers a unit after verifying its metadata.
     *
     * @throws IllegalArgumentException if the unit reports invalid metadata
     */
    public void register(AnalyzerUnit unit, AnalyzerPriority priority) {
        Objects.requireNonNull(unit, "unit is required");
        Objects.requireNonNull(priority, "priority is required");
        validate(unit);

        Registration previous = registrations.put(unit.getName(),
                new Registration(unit, priority));
        if (previous != null) {
            log.warn("Analyzer {} is already registered, replacing {} with {}",
                    unit.getName(), previous.unit().getClass().getSimpleName(), unit.getClass().getSimpleName());
        }
        log.info("Registered analyzer: {} (category={}, priority={})",
                unit.getName(), unit.getCategory(), priority);
    }

    /**
     * Removes a unit by name.
     *
     * @return true if a unit was registered under that name
     */
    public boolean unregister(String name) {
        boolean removed = registrations.remove(name) != null;
        if (removed) {
            log.info("Unregistered analyzer: {}", name);
        }
        return removed;
    }

    public Optional<AnalyzerUnit> get(String name) {
        return Optional.ofNullable(registrations.get(name)).map(Registration::unit);
    }

    public Optional<AnalyzerPriority> getPriority(String name) {
        return Optional.ofNullable(registrations.get(name)).map(Registration::priority);
    }

    public List<AnalyzerUnit> unitsForCategory(IssueCategory category) {
        return sorted().stream()
                .map(Registration::unit)
                .filter(u -> u.getCategory() == category)
                .toList();
    }

    public List<AnalyzerUnit> unitsForLanguage(String language) {
        return sorted().stream()
                .map(Registration::unit)
                .filter(u -> u.getSupportedLanguages().contains(language))
                .toList();
    }

    /**
     * Returns enabled units in execution order.
     */
    public List<AnalyzerUnit> enabledUnits() {
        return sorted().stream()
                .map(Registration::unit)
                .filter(AnalyzerUnit::isEnabled)
                .toList();
    }

    public int size() {
        return registrations.size();
    }

    public void clear() {
        registrations.clear();
        log.info("Cleared analyzer registry");
    }

    /**
     * Builds an execution plan for the given files with no filters.
     */
    public ExecutionPlan plan(Collection<ParsedFile> files) {
        return plan(files, Set.of(), Set.of());
    }

    /**
     * Builds an ordered execution plan.
     *
     * <p>Disabled units are excluded. Each remaining unit is paired only with the files whose
     * language it supports; units with no such file are left out of the plan.</p>
     *
     * @param files            parsed files to analyze
     * @param categoryFilter   categories to include, empty for all
     * @param languageFilter   languages to include, empty for all
     */
    public ExecutionPlan plan(Collection<ParsedFile> files, Set<IssueCategory> categoryFilter,
                              Set<String> languageFilter) {
        List<ExecutionPlan.PlannedTask> tasks = new ArrayList<>();
        for (Registration registration : eligible(categoryFilter, languageFilter)) {
            AnalyzerUnit unit = registration.unit();
            Set<String> languages = unit.getSupportedLanguages();
            List<ParsedFile> relevant = files.stream()
                    .filter(f -> languages.contains(f.language()))
                    .filter(f -> languageFilter.isEmpty() || languageFilter.contains(f.language()))
                    .toList();
            if (!relevant.isEmpty()) {
                tasks.add(new ExecutionPlan.PlannedTask(unit, registration.priority(), relevant));
            }
        }
        log.debug("Planned {} analyzer tasks over {} files", tasks.size(), files.size());
        return new ExecutionPlan(tasks);
    }

    /**
     * Returns a stable digest of the units eligible under the given filters.
     * Results cached under one signature are not valid for another, since a different
     * set of units would have produced different issues.
     */
    public String signature(Set<IssueCategory> categoryFilter, Set<String> languageFilter) {
        TreeSet<String> parts = new TreeSet<>();
        for (Registration registration : eligible(categoryFilter, languageFilter)) {
            AnalyzerUnit unit = registration.unit();
            parts.add(unit.getName() + '|' + unit.getCategory() + '|'
                    + new TreeSet<>(unit.getSupportedLanguages()) + '|' + unit.getConfidenceThreshold());
        }
        return Digests.sha256Hex(String.join("\n", parts));
    }

    public RegistryStats stats() {
        List<Registration> all = sorted();
        Map<IssueCategory, Integer> byCategory = new EnumMap<>(IssueCategory.class);
        Map<String, Integer> byLanguage = new HashMap<>();
        Map<AnalyzerPriority, Integer> byPriority = new EnumMap<>(AnalyzerPriority.class);
        int enabled = 0;
        for (Registration registration : all) {
            AnalyzerUnit unit = registration.unit();
            if (unit.isEnabled()) {
                enabled++;
            }
            byCategory.merge(unit.getCategory(), 1, Integer::sum);
            byPriority.merge(registration.priority(), 1, Integer::sum);
            for (String language : unit.getSupportedLanguages()) {
                byLanguage.merge(language, 1, Integer::sum);
            }
        }
        return new RegistryStats(all.size(), enabled, byCategory, byLanguage, byPriority);
    }

    private List<Registration> eligible(Set<IssueCategory> categoryFilter, Set<String> languageFilter) {
        return sorted().stream()
                .filter(r -> r.unit().isEnabled())
                .filter(r -> categoryFilter.isEmpty() || categoryFilter.contains(r.unit().getCategory()))
                .filter(r -> languageFilter.isEmpty()
                        || r.unit().getSupportedLanguages().stream().anyMatch(languageFilter::contains))
                .toList();
    }

    private List<Registration> sorted() {
        List<Registration> snapshot = new ArrayList<>(registrations.values());
        snapshot.sort(Comparator.comparingInt((Registration r) -> r.priority().getTier())
                .thenComparing(r -> r.unit().getName()));
        return snapshot;
    }

    private static void validate(AnalyzerUnit unit) {
        String name = unit.getName();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Analyzer name must not be blank");
        }
        if (unit.getCategory() == null) {
            throw new IllegalArgumentException("Analyzer " + name + " has no category");
        }
        if (unit.getSupportedLanguages() == null) {
            throw new IllegalArgumentException("Analyzer " + name + " has no supported languages");
        }
        if (unit.getSupportedLanguages().isEmpty()) {
            log.warn("Analyzer {} supports no languages and will never run", name);
        }
        double threshold = unit.getConfidenceThreshold();
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException(
                    "Analyzer " + name + " has invalid confidence threshold: " + threshold);
        }
    }

    private record Registration(AnalyzerUnit unit, AnalyzerPriority priority) {}
}
