package com.give.payout.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Entity
@Table(name = "authorized_caller")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuthorizedCallerEntity {

    @Id
    @Column(name = "caller_id", nullable = false, length = 255)
    private String callerId;

    @Column(name = "granted_at", nullable = false)
    private OffsetDateTime grantedAt;
}
