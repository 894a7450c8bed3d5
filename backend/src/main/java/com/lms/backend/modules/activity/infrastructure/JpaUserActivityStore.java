package com.lms.backend.modules.activity.infrastructure;

import java.util.List;

import com.lms.backend.modules.activity.application.StoreUnavailableException;
import com.lms.backend.modules.activity.application.UserActivityStore;
import com.lms.backend.modules.activity.domain.UserActivityRecord;
import com.lms.backend.modules.user.domain.LmsUser;
import com.lms.backend.modules.user.domain.UserRole;
import com.lms.backend.modules.user.infrastructure.persistence.LmsUserRepository;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Reads enabled students. The transaction is opened inside the translation boundary so a database that
 * cannot be reached surfaces as {@link StoreUnavailableException}, like any other storage error.
 */
@Component
public class JpaUserActivityStore implements UserActivityStore {

    private final LmsUserRepository lmsUserRepository;
    private final TransactionTemplate readOnlyTransaction;

    public JpaUserActivityStore(LmsUserRepository lmsUserRepository, PlatformTransactionManager transactionManager) {
        this.lmsUserRepository = lmsUserRepository;
        this.readOnlyTransaction = new TransactionTemplate(transactionManager);
        this.readOnlyTransaction.setReadOnly(true);
    }

    @Override
    public List<UserActivityRecord> fetchStudents() {
        try {
            return readOnlyTransaction.execute(status ->
                    lmsUserRepository.findByRoleAndAccountEnabledTrueOrderByIdAsc(UserRole.STUDENT).stream()
                            .map(JpaUserActivityStore::toRecord)
                            .toList());
        } catch (DataAccessException | TransactionException ex) {
            throw new StoreUnavailableException("failed to load students: " + ex.getMostSpecificCause().getMessage(), ex);
        }
    }

    private static UserActivityRecord toRecord(LmsUser user) {
        return new UserActivityRecord(
                user.getId(),
                user.getEmail(),
                user.getName(),
                user.getRole(),
                user.getLastActive()
        );
    }
}
