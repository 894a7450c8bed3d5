package com.lms.backend.modules.user.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;

import com.lms.backend.modules.user.domain.LmsUser;
import com.lms.backend.modules.user.domain.UserRole;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LmsUserRepository extends JpaRepository<LmsUser, Long> {

    List<LmsUser> findByRoleAndAccountEnabledTrueOrderByIdAsc(UserRole role);

    long countByAccountEnabled(boolean accountEnabled);

    long countByLastActiveIsNull();

    long countByAccountEnabledTrueAndLastActiveBefore(OffsetDateTime cutoff);

    List<LmsUser> findTop10ByLastActiveIsNotNullOrderByLastActiveDesc();

    List<LmsUser> findTop5ByAccountEnabledTrueAndLastActiveBeforeOrderByLastActiveAsc(OffsetDateTime cutoff);

    @Modifying
    @Query("""
            update LmsUser u
               set u.lastNotifiedAt = :notifiedAt
             where u.id = :userId
            """)
    int markNotified(@Param("userId") Long userId, @Param("notifiedAt") OffsetDateTime notifiedAt);
}
