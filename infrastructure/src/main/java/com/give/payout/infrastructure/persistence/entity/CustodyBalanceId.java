package com.give.payout.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CustodyBalanceId implements Serializable {

    @Column(name = "asset", nullable = false, length = 255)
    private String asset;

    @Column(name = "holder", nullable = false, length = 255)
    private String holder;
}
