package com.give.payout.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fee and recipient configuration.
 *
 * The fee recipient also acts as the fallback treasury for yield that has no
 * usable beneficiary. {@code maxFeeBps} and {@code protocolFeeBps} are fixed
 * once the router is initialized.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class FeeConfig {
    private String feeRecipient;
    private int feeBps;
    private int maxFeeBps;
    private String protocolTreasury;
    private int protocolFeeBps;
}
