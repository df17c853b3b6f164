package com.mockprep.sessiontimer.store;

import com.mockprep.sessiontimer.repository.UserAccountRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Component
@RequiredArgsConstructor
public class JpaAccountLedger implements AccountLedger {

    private final UserAccountRepository userAccountRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<Integer> getBalance(Long accountId) {
        return userAccountRepository.findCreditsById(accountId);
    }
}
