package com.meridian.controller;

import com.meridian.model.Policy;
import com.meridian.service.PolicyStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Admin API for organization policies.
 */
@Slf4j
@RestController
@RequestMapping("/v1/admin/policies")
public class PolicyController {

    private final PolicyStore policyStore;

    public PolicyController(PolicyStore policyStore) {
        this.policyStore = policyStore;
    }

    @GetMapping
    public ResponseEntity<List<Policy>> listPolicies() {
        return ResponseEntity.ok(policyStore.listPolicies());
    }

    /**
     * Effective policy, with trial clamps applied.
     */
    @GetMapping("/{orgId}")
    public ResponseEntity<Policy> getPolicy(@PathVariable String orgId) {
        return ResponseEntity.ok(policyStore.getPolicy(orgId));
    }

    /**
     * Create or replace a policy. Validation failures are returned as 400 with the violations.
     */
    @PutMapping("/{orgId}")
    public ResponseEntity<Policy> upsertPolicy(@PathVariable String orgId, @RequestBody Policy policy) {
        log.info("Admin: Upserting policy for org={}", orgId);

        return ResponseEntity.ok(policyStore.upsertPolicy(orgId, policy));
    }

    @DeleteMapping("/{orgId}")
    public ResponseEntity<Void> deletePolicy(@PathVariable String orgId) {
        log.info("Admin: Deleting policy for org={}", orgId);

        policyStore.deletePolicy(orgId);
        return ResponseEntity.noContent().build();
    }
}
