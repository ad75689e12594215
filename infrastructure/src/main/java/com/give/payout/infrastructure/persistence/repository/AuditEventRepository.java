package com.give.payout.infrastructure.persistence.repository;

import com.give.payout.infrastructure.persistence.entity.AuditEventEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AuditEventRepository extends JpaRepository<AuditEventEntity, Long> {

    List<AuditEventEntity> findByAssetOrderByIdDesc(String asset, Pageable pageable);

    List<AuditEventEntity> findAllByOrderByIdDesc(Pageable pageable);
}
