package com.give.payout.domain.store;

import com.give.payout.domain.model.ShareBook;

/**
 * Persistence for per-asset share books
 */
public interface ShareLedgerStore {

    /**
     * @return the stored book, or an empty book for an asset never written
     */
    ShareBook load(String asset);

    void save(ShareBook book);
}
