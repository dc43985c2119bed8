package com.meridian.repository;

import com.meridian.entity.DecisionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for the decision log. History filters are built as Specifications.
 */
@Repository
public interface DecisionRepository extends JpaRepository<DecisionEntity, String>,
        JpaSpecificationExecutor<DecisionEntity> {

    /**
     * Decisions of one organization in [from, to).
     */
    List<DecisionEntity> findByOrganizationIdAndCreatedAtGreaterThanEqualAndCreatedAtLessThanOrderByCreatedAtAsc(
            String organizationId, Instant from, Instant to);
}
