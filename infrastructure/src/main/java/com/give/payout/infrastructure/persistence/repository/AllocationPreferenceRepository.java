package com.give.payout.infrastructure.persistence.repository;

import com.give.payout.infrastructure.persistence.entity.AllocationPreferenceEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AllocationPreferenceRepository extends JpaRepository<AllocationPreferenceEntity, String> {
}
