package com.meridian.service;

import com.meridian.config.CacheConfiguration;
import com.meridian.config.MeridianProperties;
import com.meridian.entity.PolicyEntity;
import com.meridian.exception.InvalidPolicyException;
import com.meridian.exception.PolicyNotFoundException;
import com.meridian.model.Policy;
import com.meridian.model.TaskOverride;
import com.meridian.repository.PolicyRepository;
import com.meridian.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for PolicyStore.
 */
class PolicyStoreTest {

    private PolicyRepository repository;
    private PolicyStore store;

    @BeforeEach
    void setUp() {
        repository = mock(PolicyRepository.class);
        when(repository.save(any(PolicyEntity.class))).thenAnswer(inv -> inv.getArgument(0));
        store = new PolicyStore(repository, new ConcurrentMapCacheManager(CacheConfiguration.POLICY_CACHE),
                new MeridianProperties());
    }

    @Test
    void testValidPolicyHasNoViolations() {
        assertTrue(store.validate(Fixtures.policy().taskOverrides(Fixtures.draftingShortOverride()).build()).isEmpty());
    }

    @Test
    void testValidationReportsEveryViolation() {
        Policy policy = Fixtures.policy()
                .maxDailyCostUsd(1.0)
                .maxRequestCostUsd(2.0)
                .burstRateLimit(0)
                .allowedProviders(List.of())
                .build();

        List<String> violations = store.validate(policy);

        assertEquals(3, violations.size());
        assertTrue(violations.contains("maxRequestCostUsd: must not exceed maxDailyCostUsd"));
        assertTrue(violations.contains("burstRateLimit: must be a positive integer"));
        assertTrue(violations.contains("allowedProviders: must not be empty"));
    }

    @Test
    void testValidationChecksOverrides() {
        Map<String, TaskOverride> overrides = new HashMap<>();
        overrides.put("poetry", TaskOverride.builder().build());
        overrides.put("chat", TaskOverride.builder().minPerf(1.5).maxCost(-1.0).build());

        List<String> violations = store.validate(Fixtures.policy().taskOverrides(overrides).build());

        assertTrue(violations.contains("taskOverrides.poetry: unknown task category"));
        assertTrue(violations.contains("taskOverrides.chat.minPerf: must be within [0,1]"));
        assertTrue(violations.contains("taskOverrides.chat.maxCost: must be positive"));
    }

    @Test
    void testUpsertRejectsInvalidPolicy() {
        Policy policy = Fixtures.policy().maxDailyCostUsd(0).build();

        InvalidPolicyException e = assertThrows(InvalidPolicyException.class,
                () -> store.upsertPolicy(Fixtures.ORG, policy));

        assertTrue(e.getViolations().contains("maxDailyCostUsd: must be positive"));
        verify(repository, never()).save(any());
    }

    @Test
    void testUpsertUsesPathOrganization() {
        when(repository.findById(Fixtures.ORG)).thenReturn(Optional.empty());

        Policy saved = store.upsertPolicy(Fixtures.ORG, Fixtures.policy().organizationId("other").build());

        ArgumentCaptor<PolicyEntity> captor = ArgumentCaptor.forClass(PolicyEntity.class);
        verify(repository).save(captor.capture());
        assertEquals(Fixtures.ORG, captor.getValue().getOrganizationId());
        assertEquals(Fixtures.ORG, saved.getOrganizationId());
    }

    @Test
    void testGetUnknownPolicy() {
        when(repository.findById("nobody")).thenReturn(Optional.empty());

        PolicyNotFoundException e = assertThrows(PolicyNotFoundException.class, () -> store.getPolicy("nobody"));
        assertEquals("nobody", e.getOrganizationId());
    }

    @Test
    void testReadsAreCachedAndWritesEvict() {
        PolicyEntity entity = entity(10.0);
        when(repository.findById(Fixtures.ORG)).thenReturn(Optional.of(entity));

        assertEquals(10.0, store.getPolicy(Fixtures.ORG).getMaxDailyCostUsd());
        assertEquals(10.0, store.getPolicy(Fixtures.ORG).getMaxDailyCostUsd());
        verify(repository, times(1)).findById(Fixtures.ORG);

        store.upsertPolicy(Fixtures.ORG, Fixtures.policy().maxDailyCostUsd(25.0).build());
        when(repository.findById(Fixtures.ORG)).thenReturn(Optional.of(entity(25.0)));

        assertEquals(25.0, store.getPolicy(Fixtures.ORG).getMaxDailyCostUsd());
    }

    @Test
    void testDeleteEvictsCache() {
        when(repository.findById(Fixtures.ORG)).thenReturn(Optional.of(entity(10.0)));
        when(repository.existsById(Fixtures.ORG)).thenReturn(true);
        store.getPolicy(Fixtures.ORG);

        store.deletePolicy(Fixtures.ORG);
        when(repository.findById(Fixtures.ORG)).thenReturn(Optional.empty());

        verify(repository).deleteById(Fixtures.ORG);
        assertThrows(PolicyNotFoundException.class, () -> store.getPolicy(Fixtures.ORG));
    }

    @Test
    void testDeleteUnknownPolicy() {
        when(repository.existsById("nobody")).thenReturn(false);

        assertThrows(PolicyNotFoundException.class, () -> store.deletePolicy("nobody"));
    }

    @Test
    void testTrialPolicyIsClamped() {
        Policy trial = Fixtures.policy()
                .trial(true)
                .maxDailyCostUsd(50.0)
                .maxRequestCostUsd(0.005)
                .burstRateLimit(100)
                .build();

        Policy effective = store.applyTrialRestrictions(trial);

        assertEquals(1.0, effective.getMaxDailyCostUsd());
        assertEquals(0.005, effective.getMaxRequestCostUsd());
        assertEquals(2, effective.getMaxConcurrentJobs());
        assertEquals(5, effective.getBurstRateLimit());
        assertEquals(20, effective.getSustainedRateLimit());
        assertEquals(100_000, effective.getMaxTokensInput());
    }

    @Test
    void testNonTrialPolicyIsUnchanged() {
        Policy policy = Fixtures.policy().build();

        assertSame(policy, store.applyTrialRestrictions(policy));
    }

    private static PolicyEntity entity(double maxDaily) {
        PolicyEntity entity = new PolicyEntity();
        entity.setOrganizationId(Fixtures.ORG);
        entity.setMaxDailyCostUsd(maxDaily);
        entity.setMaxRequestCostUsd(1.0);
        entity.setMaxTokensInput(100_000);
        entity.setMaxTokensOutput(16_000);
        entity.setMaxConcurrentJobs(10);
        entity.setAllowedProviders(List.of("openai"));
        entity.setBurstRateLimit(100);
        entity.setSustainedRateLimit(1000);
        return entity;
    }
}
