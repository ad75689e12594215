package com.give.payout.infrastructure.persistence.repository;

import com.give.payout.infrastructure.persistence.entity.CustodyBalanceEntity;
import com.give.payout.infrastructure.persistence.entity.CustodyBalanceId;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CustodyBalanceRepository extends JpaRepository<CustodyBalanceEntity, CustodyBalanceId> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM CustodyBalanceEntity c WHERE c.id = :id")
    Optional<CustodyBalanceEntity> findForUpdate(@Param("id") CustodyBalanceId id);
}
