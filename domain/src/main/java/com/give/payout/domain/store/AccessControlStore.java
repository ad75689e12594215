package com.give.payout.domain.store;

import java.util.Set;

/**
 * Authorized caller set and global pause flag
 */
public interface AccessControlStore {

    boolean isAuthorizedCaller(String caller);

    void setAuthorizedCaller(String caller, boolean authorized);

    Set<String> authorizedCallers();

    boolean isPaused();

    void setPaused(boolean paused);
}
