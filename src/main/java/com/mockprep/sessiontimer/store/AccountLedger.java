package com.mockprep.sessiontimer.store;

import java.util.Optional;

public interface AccountLedger {

    /**
     * @return the current credit balance, empty when the account does not exist
     */
    Optional<Integer> getBalance(Long accountId);
}
