package com.give.payout.application.support;

import com.give.payout.domain.model.ShareBook;
import com.give.payout.domain.store.ShareLedgerStore;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Keeps detached copies so unsaved changes never leak into the store
 */
public class InMemoryShareLedgerStore implements ShareLedgerStore {

    private final Map<String, ShareBook> books = new HashMap<>();
    private int saves;

    @Override
    public ShareBook load(String asset) {
        ShareBook stored = books.get(asset);
        return stored == null ? new ShareBook(asset) : copy(stored);
    }

    @Override
    public void save(ShareBook book) {
        books.put(book.getAsset(), copy(book));
        saves++;
    }

    public int getSaves() {
        return saves;
    }

    private static ShareBook copy(ShareBook book) {
        Map<String, BigInteger> shares = new HashMap<>();
        for (String stakeholder : book.getActiveStakeholders()) {
            shares.put(stakeholder, book.sharesOf(stakeholder));
        }
        return new ShareBook(book.getAsset(), book.getTotalShares(), shares, book.getActiveStakeholders());
    }
}
