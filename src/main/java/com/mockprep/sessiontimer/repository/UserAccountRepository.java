package com.mockprep.sessiontimer.repository;

import com.mockprep.sessiontimer.model.UserAccount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface UserAccountRepository extends JpaRepository<UserAccount, Long> {

    @Query("select u.credits from UserAccount u where u.id = :id")
    Optional<Integer> findCreditsById(@Param("id") Long id);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update UserAccount u set u.credits = u.credits - 1 where u.id = :id and u.credits > 0")
    int deductOneCredit(@Param("id") Long id);
}
