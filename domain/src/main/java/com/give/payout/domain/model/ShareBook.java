package com.give.payout.domain.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Share ledger for one asset.
 *
 * Holds every stakeholder's share balance, the per-asset total and the index of
 * active stakeholders (nonzero balance). The index is a dense list plus a
 * stakeholder -> slot lookup, so insertion appends and removal swaps the
 * departing entry with the last one before truncating. Index order is
 * therefore not stable across removals.
 *
 * Invariants:
 * - sum(shares) == totalShares
 * - a stakeholder is in the index at most once, and iff its balance is nonzero
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
public class ShareBook {

    private final String asset;
    private BigInteger totalShares;
    private final Map<String, BigInteger> shares;
    private final List<String> active;

    @JsonIgnore
    private final Map<String, Integer> positions;

    public ShareBook(String asset) {
        this(asset, BigInteger.ZERO, null, null);
    }

    @JsonCreator
    public ShareBook(@JsonProperty("asset") String asset,
                     @JsonProperty("totalShares") BigInteger totalShares,
                     @JsonProperty("shares") Map<String, BigInteger> shares,
                     @JsonProperty("active") List<String> active) {
        this.asset = asset;
        this.totalShares = totalShares != null ? totalShares : BigInteger.ZERO;
        this.shares = shares != null ? new HashMap<>(shares) : new HashMap<>();
        this.active = active != null ? new ArrayList<>(active) : new ArrayList<>();
        this.positions = new HashMap<>();
        for (int i = 0; i < this.active.size(); i++) {
            positions.put(this.active.get(i), i);
        }
    }

    /**
     * Overwrite a stakeholder's balance, keeping total and index consistent.
     * Writing the current balance again is a no-op for both.
     */
    public ShareChange setShares(String stakeholder, BigInteger newAmount) {
        UInt256.checked(newAmount, "shares");
        BigInteger oldAmount = sharesOf(stakeholder);
        BigInteger newTotal = UInt256.checked(totalShares.add(newAmount).subtract(oldAmount), "totalShares");

        totalShares = newTotal;
        if (newAmount.signum() == 0) {
            shares.remove(stakeholder);
        } else {
            shares.put(stakeholder, newAmount);
        }

        MembershipChange membership = MembershipChange.UNCHANGED;
        if (oldAmount.signum() == 0 && newAmount.signum() > 0) {
            if (addActive(stakeholder)) {
                membership = MembershipChange.JOINED;
            }
        } else if (oldAmount.signum() > 0 && newAmount.signum() == 0) {
            if (removeActive(stakeholder)) {
                membership = MembershipChange.LEFT;
            }
        }
        return new ShareChange(asset, stakeholder, oldAmount, newAmount, totalShares, membership);
    }

    public BigInteger sharesOf(String stakeholder) {
        return shares.getOrDefault(stakeholder, BigInteger.ZERO);
    }

    public String getAsset() {
        return asset;
    }

    public BigInteger getTotalShares() {
        return totalShares;
    }

    /**
     * Read-only view of the active index in its current slot order
     */
    public List<String> getActiveStakeholders() {
        return Collections.unmodifiableList(active);
    }

    public int getActiveCount() {
        return active.size();
    }

    public boolean isActive(String stakeholder) {
        return positions.containsKey(stakeholder);
    }

    /**
     * Full check of both invariants. Linear in the number of stakeholders.
     */
    public boolean isConsistent() {
        BigInteger sum = BigInteger.ZERO;
        for (String stakeholder : active) {
            sum = sum.add(sharesOf(stakeholder));
        }
        if (!sum.equals(totalShares) || positions.size() != active.size() || shares.size() != active.size()) {
            return false;
        }
        for (int i = 0; i < active.size(); i++) {
            String stakeholder = active.get(i);
            Integer slot = positions.get(stakeholder);
            if (slot == null || slot != i || sharesOf(stakeholder).signum() <= 0) {
                return false;
            }
        }
        return true;
    }

    private boolean addActive(String stakeholder) {
        if (positions.containsKey(stakeholder)) {
            return false;
        }
        positions.put(stakeholder, active.size());
        active.add(stakeholder);
        return true;
    }

    private boolean removeActive(String stakeholder) {
        Integer slot = positions.remove(stakeholder);
        if (slot == null) {
            return false;
        }
        int lastSlot = active.size() - 1;
        String last = active.remove(lastSlot);
        if (slot != lastSlot) {
            active.set(slot, last);
            positions.put(last, slot);
        }
        return true;
    }
}
