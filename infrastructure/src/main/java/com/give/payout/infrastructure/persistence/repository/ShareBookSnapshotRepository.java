package com.give.payout.infrastructure.persistence.repository;

import com.give.payout.infrastructure.persistence.entity.ShareBookSnapshotEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ShareBookSnapshotRepository extends JpaRepository<ShareBookSnapshotEntity, String> {
}
