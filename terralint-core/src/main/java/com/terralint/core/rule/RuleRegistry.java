package com.terralint.core.rule;

import com.terralint.core.config.ConfigurationException;
import com.terralint.core.model.RuleCategory;
import com.terralint.core.model.Severity;

import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Table of registered rules, keyed by rule id.
 *
 * <p>Rules are registered explicitly; {@link #builtIn()} registers the table from
 * {@link BuiltInRules#all()}. The registry is filled once at start-up and read-only
 * afterwards.</p>
 */
public class RuleRegistry {

    private final Map<String, RuleDescriptor> descriptors = new LinkedHashMap<>();

    /**
     * Creates a registry holding every built-in rule.
     *
     * @return populated registry
     */
    public static RuleRegistry builtIn() {
        RuleRegistry registry = new RuleRegistry();
        BuiltInRules.all().forEach(registry::register);
        return registry;
    }

    /**
     * Registers a rule.
     *
     * @param rule rule to register
     * @throws IllegalArgumentException if a rule with the same id is already registered
     */
    public void register(LintRule rule) {
        RuleDescriptor descriptor = RuleDescriptor.of(rule);
        if (descriptors.putIfAbsent(descriptor.id(), descriptor) != null) {
            throw new IllegalArgumentException("Duplicate rule id: " + descriptor.id());
        }
    }

    /**
     * Returns all descriptors sorted by rule id.
     *
     * @return descriptors
     */
    public List<RuleDescriptor> all() {
        return descriptors.values().stream()
            .sorted(Comparator.comparing(RuleDescriptor::id))
            .toList();
    }

    public Optional<RuleDescriptor> find(String ruleId) {
        return Optional.ofNullable(descriptors.get(ruleId));
    }

    public int size() {
        return descriptors.size();
    }

    /**
     * Selects the rules of a run.
     *
     * @param categories category codes to include; empty means all
     * @param excludedIds rule ids to skip
     * @param severities severities to include; empty means all
     * @return selected descriptors sorted by id
     * @throws ConfigurationException if a category, rule id or severity is unknown
     */
    public List<RuleDescriptor> select(Collection<String> categories, Collection<String> excludedIds,
                                       Collection<String> severities) {
        Set<RuleCategory> selectedCategories = parseCategories(categories);
        Set<Severity> selectedSeverities = parseSeverities(severities);
        for (String id : excludedIds) {
            if (!descriptors.containsKey(id.trim())) {
                throw new ConfigurationException("Unknown rule id: '" + id.trim() + "'");
            }
        }
        Set<String> excluded = excludedIds.stream().map(String::trim).collect(Collectors.toSet());

        return all().stream()
            .filter(d -> selectedCategories.contains(d.category()))
            .filter(d -> selectedSeverities.contains(d.severity()))
            .filter(d -> !excluded.contains(d.id()))
            .toList();
    }

    /**
     * Checks rule ids, categories and severities without selecting anything.
     *
     * @param categories category codes
     * @param ruleIds rule ids
     * @param severities severity names
     * @throws ConfigurationException on the first unknown value
     */
    public void validate(Collection<String> categories, Collection<String> ruleIds, Collection<String> severities) {
        select(categories, ruleIds, severities);
    }

    private static Set<RuleCategory> parseCategories(Collection<String> codes) {
        if (codes.isEmpty()) {
            return EnumSet.allOf(RuleCategory.class);
        }
        Set<RuleCategory> result = EnumSet.noneOf(RuleCategory.class);
        for (String code : codes) {
            result.add(RuleCategory.fromCode(code)
                .orElseThrow(() -> new ConfigurationException("Unknown rule category: '" + code.trim() + "'")));
        }
        return result;
    }

    private static Set<Severity> parseSeverities(Collection<String> names) {
        if (names.isEmpty()) {
            return EnumSet.allOf(Severity.class);
        }
        Set<Severity> result = EnumSet.noneOf(Severity.class);
        for (String name : names) {
            try {
                result.add(Severity.fromString(name));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Unknown severity: '" + name.trim() + "'", e);
            }
        }
        return result;
    }
}
