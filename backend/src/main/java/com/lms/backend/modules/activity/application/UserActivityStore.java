package com.lms.backend.modules.activity.application;

import java.util.List;

import com.lms.backend.modules.activity.domain.UserActivityRecord;

/**
 * Read port onto the LMS user store.
 */
public interface UserActivityStore {

    /**
     * Loads every student eligible for inactivity monitoring.
     *
     * @throws StoreUnavailableException when the store cannot be queried
     */
    List<UserActivityRecord> fetchStudents();
}
