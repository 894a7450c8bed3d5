package com.lms.backend.support;

import java.time.OffsetDateTime;

import com.lms.backend.modules.user.domain.LmsUser;
import com.lms.backend.modules.user.domain.UserRole;
import com.lms.backend.modules.user.infrastructure.persistence.LmsUserRepository;

import org.springframework.stereotype.Component;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.annotation.Transactional;

@Component
@Transactional
public class TestUserFactory {

    private final LmsUserRepository lmsUserRepository;

    public TestUserFactory(LmsUserRepository lmsUserRepository) {
        this.lmsUserRepository = lmsUserRepository;
    }

    public LmsUser createStudent(String name, String email, OffsetDateTime lastActive) {
        return lmsUserRepository.save(newUser(name, email, UserRole.STUDENT, lastActive, true));
    }

    public LmsUser createUser(String name, String email, UserRole role, OffsetDateTime lastActive, boolean enabled) {
        return lmsUserRepository.save(newUser(name, email, role, lastActive, enabled));
    }

    /**
     * Unsaved user with a fixed id, for tests that never touch the database.
     */
    public static LmsUser detached(long id, String email, OffsetDateTime lastActive, boolean enabled) {
        LmsUser user = newUser("User " + id, email, UserRole.STUDENT, lastActive, enabled);
        ReflectionTestUtils.setField(user, "id", id);
        return user;
    }

    private static LmsUser newUser(
            String name,
            String email,
            UserRole role,
            OffsetDateTime lastActive,
            boolean enabled
    ) {
        LmsUser user = new LmsUser();
        user.setName(name);
        user.setEmail(email);
        user.setRole(role);
        user.setLastActive(lastActive);
        user.setAccountEnabled(enabled);
        return user;
    }
}
