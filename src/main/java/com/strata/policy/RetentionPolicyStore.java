package com.strata.policy;

import com.strata.domain.DatasetSelector;
import com.strata.error.InvalidPolicyException;
import com.strata.error.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Holds the named retention policies and guards every mutation with
 * {@link #validate(RetentionPolicy)}.
 *
 * Reads are served from an immutable snapshot; mutations are serialized and
 * persisted before the snapshot is swapped, so a failed write leaves the
 * in-memory state unchanged.
 */
public class RetentionPolicyStore {
    private static final Logger logger = LoggerFactory.getLogger(RetentionPolicyStore.class);

    private final PolicyRepository repository;
    private final Clock clock;
    private final Duration downsampleBucket;

    private volatile Map<String, RetentionPolicy> policies = Map.of();

    public RetentionPolicyStore(PolicyRepository repository, Clock clock, Duration downsampleBucket) {
        this.repository = repository;
        this.clock = clock;
        this.downsampleBucket = downsampleBucket;
        reload();
    }

    /**
     * Re-read the persisted policies, e.g. after a restore replaced the file.
     * Entries failing the field rules and repeated names are skipped with a
     * warning; they are dropped from the file on the next mutation.
     */
    public synchronized void reload() {
        Map<String, RetentionPolicy> loaded = new LinkedHashMap<>();
        int skipped = 0;
        for (RetentionPolicy policy : repository.load()) {
            List<String> errors = validate(policy, List.of());
            if (!errors.isEmpty()) {
                logger.warn("Skipping invalid retention policy {}: {}",
                    policy != null ? policy.getName() : null, errors);
                skipped++;
            } else if (loaded.containsKey(policy.getName())) {
                logger.warn("Skipping duplicate retention policy {}", policy.getName());
                skipped++;
            } else {
                loaded.put(policy.getName(), policy);
            }
        }
        policies = Map.copyOf(loaded);
        logger.info("Loaded {} retention policies ({} skipped)", loaded.size(), skipped);
    }

    /**
     * Validate a policy against the field rules and against the other enabled
     * policies. An empty list means the policy is acceptable.
     */
    public List<String> validate(RetentionPolicy policy) {
        return validate(policy, policies.values());
    }

    /**
     * Validate a complete policy set on its own, e.g. one read from a backup,
     * without looking at the live policies.
     */
    public List<String> validateAll(Collection<RetentionPolicy> candidates) {
        List<String> errors = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (RetentionPolicy policy : candidates) {
            if (policy != null && policy.getName() != null && !names.add(policy.getName())) {
                errors.add("duplicate policy name '" + policy.getName() + "'");
            }
            for (String error : validate(policy, candidates)) {
                errors.add((policy != null ? policy.getName() : null) + ": " + error);
            }
        }
        return errors;
    }

    private List<String> validate(RetentionPolicy policy, Collection<RetentionPolicy> others) {
        List<String> errors = new ArrayList<>();
        if (policy == null) {
            errors.add("policy must not be null");
            return errors;
        }
        if (policy.getName() == null || policy.getName().trim().isEmpty()) {
            errors.add("name must not be empty");
        }
        if (policy.getRetention() == null) {
            errors.add("retention must be set");
        } else if (policy.getRetention().isZero() || policy.getRetention().isNegative()) {
            errors.add("retention must be positive");
        }
        if (policy.getAction() == null) {
            errors.add("action must be one of delete, downsample, archive");
        }
        if (policy.getDatasetSelector() == null || policy.getDatasetSelector().isBlank()) {
            errors.add("dataset selector must not be empty");
        } else if (!DatasetSelector.isValid(policy.getDatasetSelector())) {
            errors.add("dataset selector may only contain letters, digits, '_', '.', '-' and a trailing '*'");
        }
        if (policy.getAction() == PolicyAction.DOWNSAMPLE) {
            if (policy.getStatisticKind() == null) {
                errors.add("downsample policies must declare a statistic kind (mean, min, max or sum)");
            }
            if (policy.getRetention() != null && policy.getRetention().compareTo(downsampleBucket) < 0) {
                errors.add("downsample retention must be at least one bucket (" + downsampleBucket + ")");
            }
        }
        if (errors.isEmpty() && policy.isEnabled()) {
            errors.addAll(findConflicts(policy, others));
        }
        return errors;
    }

    private List<String> findConflicts(RetentionPolicy candidate, Collection<RetentionPolicy> others) {
        List<String> conflicts = new ArrayList<>();
        DatasetSelector selector = candidate.selector();
        for (RetentionPolicy other : others) {
            if (other == null || other == candidate || !other.isEnabled()
                    || Objects.equals(other.getName(), candidate.getName())
                    || other.getAction() == null || other.getRetention() == null
                    || !DatasetSelector.isValid(other.getDatasetSelector())) {
                continue;
            }
            if (!selector.overlaps(other.selector())) {
                continue;
            }
            if (conflicts(candidate, other)) {
                conflicts.add("conflicts with enabled policy '" + other.getName() + "' ("
                    + other.getAction().getValue() + " on " + other.getDatasetSelector() + ")");
            }
        }
        return conflicts;
    }

    /**
     * Overlapping policies are compatible only as a tier chain: one DOWNSAMPLE
     * followed by one cold action with strictly longer retention.
     */
    private static boolean conflicts(RetentionPolicy a, RetentionPolicy b) {
        if (a.getAction() == b.getAction()) {
            return true;
        }
        if (a.getAction().isColdAction() && b.getAction().isColdAction()) {
            return true;
        }
        RetentionPolicy downsample = a.getAction() == PolicyAction.DOWNSAMPLE ? a : b;
        RetentionPolicy cold = downsample == a ? b : a;
        return downsample.getRetention().compareTo(cold.getRetention()) >= 0;
    }

    public synchronized RetentionPolicy add(RetentionPolicy policy) {
        List<String> errors = validate(policy);
        if (policy != null && policy.getName() != null && policies.containsKey(policy.getName().trim())) {
            errors.add("a policy named '" + policy.getName() + "' already exists");
        }
        if (!errors.isEmpty()) {
            throw new InvalidPolicyException(policy != null ? policy.getName() : null, errors);
        }

        RetentionPolicy stored = policy.copy();
        stored.setName(policy.getName().trim());
        Instant now = clock.instant();
        stored.setCreatedAt(now);
        stored.setUpdatedAt(now);

        Map<String, RetentionPolicy> next = new LinkedHashMap<>(policies);
        next.put(stored.getName(), stored);
        commit(next);
        logger.info("Added retention policy {}", stored);
        return stored.copy();
    }

    public synchronized RetentionPolicy update(RetentionPolicy policy) {
        if (policy != null && policy.getName() != null && !policies.containsKey(policy.getName())) {
            throw new NotFoundException("policy", policy.getName());
        }
        List<String> errors = validate(policy);
        if (!errors.isEmpty()) {
            throw new InvalidPolicyException(policy != null ? policy.getName() : null, errors);
        }

        RetentionPolicy existing = policies.get(policy.getName());
        RetentionPolicy stored = policy.copy();
        stored.setCreatedAt(existing.getCreatedAt());
        stored.setUpdatedAt(clock.instant());

        Map<String, RetentionPolicy> next = new LinkedHashMap<>(policies);
        next.put(stored.getName(), stored);
        commit(next);
        logger.info("Updated retention policy {}", stored);
        return stored.copy();
    }

    /**
     * Enable or disable a policy. Disabling is preferred over removal since it
     * keeps the definition for audit.
     */
    public synchronized RetentionPolicy setEnabled(String name, boolean enabled) {
        RetentionPolicy existing = policies.get(name);
        if (existing == null) {
            throw new NotFoundException("policy", name);
        }
        RetentionPolicy changed = existing.copy();
        changed.setEnabled(enabled);
        return update(changed);
    }

    public synchronized void remove(String name) {
        if (name == null || !policies.containsKey(name)) {
            throw new NotFoundException("policy", name);
        }
        Map<String, RetentionPolicy> next = new LinkedHashMap<>(policies);
        next.remove(name);
        commit(next);
        logger.info("Removed retention policy {}", name);
    }

    private void commit(Map<String, RetentionPolicy> next) {
        repository.save(new ArrayList<>(next.values()));
        policies = Map.copyOf(next);
    }

    public List<RetentionPolicy> list() {
        return policies.values().stream()
            .map(RetentionPolicy::copy)
            .sorted((a, b) -> a.getName().compareTo(b.getName()))
            .collect(Collectors.toList());
    }

    public Optional<RetentionPolicy> get(String name) {
        return Optional.ofNullable(policies.get(name)).map(RetentionPolicy::copy);
    }

    public List<RetentionPolicy> enabled(PolicyAction action) {
        return list().stream()
            .filter(RetentionPolicy::isEnabled)
            .filter(p -> p.getAction() == action)
            .collect(Collectors.toList());
    }

    /**
     * Compute the tier window for a policy at {@code now}.
     *
     * For DOWNSAMPLE the warm cutoff comes from the overlapping cold policy, or
     * the epoch when there is none. For cold actions both cutoffs coincide.
     */
    public TierWindow windowFor(RetentionPolicy policy, Instant now) {
        Instant cutoff = policy.cutoff(now);
        if (policy.getAction() != PolicyAction.DOWNSAMPLE) {
            return new TierWindow(cutoff, cutoff);
        }
        DatasetSelector selector = policy.selector();
        Instant warmCutoff = Instant.EPOCH;
        for (RetentionPolicy other : policies.values()) {
            if (other.isEnabled() && other.getAction().isColdAction() && other.selector().overlaps(selector)) {
                Instant otherCutoff = other.cutoff(now);
                if (otherCutoff.isAfter(warmCutoff)) {
                    warmCutoff = otherCutoff;
                }
            }
        }
        if (warmCutoff.isAfter(cutoff)) {
            warmCutoff = cutoff;
        }
        return new TierWindow(cutoff, warmCutoff);
    }

    /**
     * Snapshot of policy counts for status reporting.
     */
    public Map<String, Object> statistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        List<RetentionPolicy> all = list();
        stats.put("total_policies", all.size());
        stats.put("enabled_policies", all.stream().filter(RetentionPolicy::isEnabled).count());
        Map<PolicyAction, Long> byAction = new EnumMap<>(PolicyAction.class);
        for (RetentionPolicy policy : all) {
            byAction.merge(policy.getAction(), 1L, Long::sum);
        }
        stats.put("policies_by_action", byAction);
        return stats;
    }

    public PolicyRepository getRepository() {
        return repository;
    }
}
