package com.give.payout.infrastructure.persistence.repository;

import com.give.payout.infrastructure.persistence.entity.DistributionStatsEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface DistributionStatsRepository extends JpaRepository<DistributionStatsEntity, String> {
}
