package com.give.payout.infrastructure.persistence.repository;

import com.give.payout.infrastructure.persistence.entity.AuthorizedCallerEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AuthorizedCallerRepository extends JpaRepository<AuthorizedCallerEntity, String> {
}
