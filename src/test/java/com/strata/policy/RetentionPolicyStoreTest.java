package com.strata.policy;

import com.strata.config.JacksonConfig;
import com.strata.domain.StatisticKind;
import com.strata.error.InvalidPolicyException;
import com.strata.error.NotFoundException;
import com.strata.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RetentionPolicyStore Tests")
class RetentionPolicyStoreTest {

    private static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");

    @TempDir
    Path configDir;

    private PolicyRepository repository;
    private RetentionPolicyStore store;

    @BeforeEach
    void setUp() {
        repository = new PolicyRepository(configDir, JacksonConfig.createObjectMapper());
        store = new RetentionPolicyStore(repository, new MutableClock(NOW), Duration.ofHours(1));
    }

    @Test
    @DisplayName("Should reject zero, negative and missing retention")
    void shouldRejectNonPositiveRetention() {
        assertThat(store.validate(deletePolicy("a", "events", Duration.ZERO)))
            .contains("retention must be positive");
        assertThat(store.validate(deletePolicy("b", "events", Duration.ofDays(-1))))
            .contains("retention must be positive");
        assertThat(store.validate(deletePolicy("c", "events", null)))
            .contains("retention must be set");
    }

    @Test
    @DisplayName("Should reject empty names and malformed selectors")
    void shouldRejectEmptyNameAndMalformedSelector() {
        assertThat(store.validate(deletePolicy("  ", "events", Duration.ofDays(1))))
            .contains("name must not be empty");
        assertThat(store.validate(deletePolicy("x", "", Duration.ofDays(1))))
            .contains("dataset selector must not be empty");
        assertThat(store.validate(deletePolicy("x", "ev*ents", Duration.ofDays(1))))
            .anyMatch(error -> error.startsWith("dataset selector may only contain"));
        assertThat(store.validate(deletePolicy("x", "../etc", Duration.ofDays(1))))
            .anyMatch(error -> error.startsWith("dataset selector may only contain"));
    }

    @Test
    @DisplayName("Downsample policies must declare a statistic kind and cover a bucket")
    void shouldRequireStatisticKindForDownsample() {
        RetentionPolicy noKind = RetentionPolicy.builder()
            .name("ds").datasetSelector("cpu").retention(Duration.ofDays(7))
            .action(PolicyAction.DOWNSAMPLE).build();
        RetentionPolicy tooShort = downsamplePolicy("ds2", "cpu", Duration.ofMinutes(30));

        assertThat(store.validate(noKind)).anyMatch(error -> error.contains("statistic kind"));
        assertThat(store.validate(tooShort)).anyMatch(error -> error.contains("at least one bucket"));
    }

    @Test
    @DisplayName("Should persist added policies and reload them")
    void shouldPersistAndReload() {
        // Given
        store.add(downsamplePolicy("cpu-rollup", "cpu.*", Duration.ofDays(7)));

        // When
        RetentionPolicyStore reopened = new RetentionPolicyStore(repository, new MutableClock(NOW), Duration.ofHours(1));

        // Then
        assertThat(Files.exists(configDir.resolve(PolicyRepository.POLICIES_FILE))).isTrue();
        assertThat(reopened.get("cpu-rollup")).isPresent();
        RetentionPolicy loaded = reopened.get("cpu-rollup").orElseThrow();
        assertThat(loaded.getRetention()).isEqualTo(Duration.ofDays(7));
        assertThat(loaded.getStatisticKind()).isEqualTo(StatisticKind.MEAN);
        assertThat(loaded.getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("add should throw InvalidPolicyException carrying every error")
    void addShouldRejectInvalidPolicy() {
        RetentionPolicy invalid = deletePolicy("", "", Duration.ZERO);

        assertThatThrownBy(() -> store.add(invalid))
            .isInstanceOf(InvalidPolicyException.class)
            .satisfies(e -> assertThat(((InvalidPolicyException) e).getErrors()).hasSizeGreaterThanOrEqualTo(3));
        assertThat(store.list()).isEmpty();
    }

    @Test
    @DisplayName("add should reject a duplicate name")
    void addShouldRejectDuplicateName() {
        store.add(deletePolicy("purge", "logs", Duration.ofDays(30)));

        assertThatThrownBy(() -> store.add(deletePolicy(" purge ", "other", Duration.ofDays(30))))
            .isInstanceOf(InvalidPolicyException.class);
    }

    @Test
    @DisplayName("update and remove of an unknown policy should throw NotFoundException")
    void shouldThrowNotFoundForUnknownPolicy() {
        assertThatThrownBy(() -> store.update(deletePolicy("ghost", "logs", Duration.ofDays(1))))
            .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> store.remove("ghost"))
            .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> store.setEnabled("ghost", false))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Two enabled policies with the same action on overlapping selectors conflict")
    void shouldRejectSameActionOnOverlappingSelectors() {
        store.add(deletePolicy("all-logs", "logs.*", Duration.ofDays(30)));

        List<String> errors = store.validate(deletePolicy("app-logs", "logs.app", Duration.ofDays(10)));

        assertThat(errors).anyMatch(error -> error.contains("conflicts with enabled policy 'all-logs'"));
    }

    @Test
    @DisplayName("DELETE and ARCHIVE on overlapping selectors conflict")
    void shouldRejectDeleteAndArchiveOverlap() {
        store.add(deletePolicy("purge", "metrics", Duration.ofDays(90)));

        RetentionPolicy archive = RetentionPolicy.builder()
            .name("cold").datasetSelector("metr*").retention(Duration.ofDays(365))
            .action(PolicyAction.ARCHIVE).build();

        assertThat(store.validate(archive)).isNotEmpty();
    }

    @Test
    @DisplayName("A downsample policy must be strictly shorter than the overlapping cold policy")
    void shouldRequireDownsampleShorterThanColdPolicy() {
        store.add(deletePolicy("purge", "cpu", Duration.ofDays(30)));

        assertThat(store.validate(downsamplePolicy("rollup", "cpu", Duration.ofDays(30)))).isNotEmpty();
        assertThat(store.validate(downsamplePolicy("rollup", "cpu", Duration.ofDays(7)))).isEmpty();
    }

    @Test
    @DisplayName("Disabled policies never conflict")
    void disabledPoliciesShouldNotConflict() {
        store.add(deletePolicy("purge", "cpu", Duration.ofDays(30)));
        store.setEnabled("purge", false);

        RetentionPolicy other = deletePolicy("purge-2", "cpu", Duration.ofDays(10));

        assertThat(store.validate(other)).isEmpty();
        assertThatCode(() -> store.setEnabled("purge", true)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Re-enabling a policy is rejected when it would now conflict")
    void enablingShouldRevalidate() {
        store.add(deletePolicy("purge", "cpu", Duration.ofDays(30)));
        store.setEnabled("purge", false);
        store.add(deletePolicy("purge-2", "cpu", Duration.ofDays(10)));

        assertThatThrownBy(() -> store.setEnabled("purge", true))
            .isInstanceOf(InvalidPolicyException.class);
        assertThat(store.get("purge").orElseThrow().isEnabled()).isFalse();
    }

    @Test
    @DisplayName("update should keep the creation time and stamp the update time")
    void updateShouldKeepCreationTime() {
        MutableClock clock = new MutableClock(NOW);
        RetentionPolicyStore timed = new RetentionPolicyStore(repository, clock, Duration.ofHours(1));
        timed.add(deletePolicy("purge", "logs", Duration.ofDays(30)));
        clock.advance(Duration.ofHours(2));

        RetentionPolicy updated = timed.update(deletePolicy("purge", "logs", Duration.ofDays(60)));

        assertThat(updated.getCreatedAt()).isEqualTo(NOW);
        assertThat(updated.getUpdatedAt()).isEqualTo(NOW.plus(Duration.ofHours(2)));
        assertThat(timed.get("purge").orElseThrow().getRetention()).isEqualTo(Duration.ofDays(60));
    }

    @Test
    @DisplayName("Returned policies are detached copies")
    void returnedPoliciesShouldBeCopies() {
        store.add(deletePolicy("purge", "logs", Duration.ofDays(30)));

        store.get("purge").orElseThrow().setRetention(Duration.ofDays(1));

        assertThat(store.get("purge").orElseThrow().getRetention()).isEqualTo(Duration.ofDays(30));
    }

    @Test
    @DisplayName("validateAll should check a set on its own, including duplicate names")
    void validateAllShouldCheckStandaloneSet() {
        store.add(deletePolicy("live", "cpu", Duration.ofDays(30)));

        List<String> clean = store.validateAll(List.of(deletePolicy("other", "cpu", Duration.ofDays(5))));
        List<String> duplicated = store.validateAll(List.of(
            deletePolicy("dup", "a", Duration.ofDays(5)),
            deletePolicy("dup", "b", Duration.ofDays(5))));

        assertThat(clean).isEmpty();
        assertThat(duplicated).anyMatch(error -> error.contains("duplicate policy name 'dup'"));
    }

    @Test
    @DisplayName("Downsample window should end at the overlapping cold policy cutoff")
    void windowForShouldUseOverlappingColdPolicy() {
        store.add(deletePolicy("purge", "cpu.*", Duration.ofDays(30)));
        RetentionPolicy rollup = store.add(downsamplePolicy("rollup", "cpu.host", Duration.ofDays(7)));

        TierWindow window = store.windowFor(rollup, NOW);

        assertThat(window.getHotCutoff()).isEqualTo(NOW.minus(Duration.ofDays(7)));
        assertThat(window.getWarmCutoff()).isEqualTo(NOW.minus(Duration.ofDays(30)));
        assertThat(window.downsampleRange().getStart()).isEqualTo(NOW.minus(Duration.ofDays(30)));
    }

    @Test
    @DisplayName("Downsample window should reach back to the epoch without a cold policy")
    void windowForWithoutColdPolicyStartsAtEpoch() {
        RetentionPolicy rollup = store.add(downsamplePolicy("rollup", "cpu", Duration.ofDays(7)));

        TierWindow window = store.windowFor(rollup, NOW);

        assertThat(window.getWarmCutoff()).isEqualTo(Instant.EPOCH);
    }

    @Test
    @DisplayName("statistics should count policies by action")
    void statisticsShouldCountPolicies() {
        store.add(deletePolicy("purge", "logs", Duration.ofDays(30)));
        store.add(downsamplePolicy("rollup", "cpu", Duration.ofDays(7)));
        store.setEnabled("purge", false);

        assertThat(store.statistics())
            .containsEntry("total_policies", 2)
            .containsEntry("enabled_policies", 1L);
    }

    @Test
    @DisplayName("Reload skips hand-edited entries that fail validation")
    void reloadShouldSkipInvalidEntries() throws Exception {
        // Given
        Files.createDirectories(configDir);
        Files.writeString(repository.getFile(), """
            [
              {"name": "logs-purge", "dataset_selector": "logs.*", "retention": "P30D", "action": "delete"},
              {"name": "broken", "dataset_selector": "cpu", "retention": "P7D"},
              {"name": "logs-purge", "dataset_selector": "logs", "retention": "P1D", "action": "delete"}
            ]
            """);

        // When
        store.reload();

        // Then
        assertThat(store.list()).extracting(RetentionPolicy::getName).containsExactly("logs-purge");
        RetentionPolicy kept = store.get("logs-purge").orElseThrow();
        assertThat(kept.getRetention()).isEqualTo(Duration.ofDays(30));
        assertThatCode(() -> store.windowFor(kept, NOW)).doesNotThrowAnyException();
    }

    private static RetentionPolicy deletePolicy(String name, String selector, Duration retention) {
        return RetentionPolicy.builder()
            .name(name).datasetSelector(selector).retention(retention)
            .action(PolicyAction.DELETE).build();
    }

    static RetentionPolicy downsamplePolicy(String name, String selector, Duration retention) {
        return RetentionPolicy.builder()
            .name(name).datasetSelector(selector).retention(retention)
            .action(PolicyAction.DOWNSAMPLE).statisticKind(StatisticKind.MEAN).build();
    }
}
