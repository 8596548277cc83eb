package com.gt.subjunctive.attempt;

import com.gt.subjunctive.model.Attempt;

import java.util.List;

// Attempts are append-only. The only removal is erasing a user's account
public interface AttemptDao {

    void saveAttempt(Attempt attempt);

    List<Attempt> loadRecentAttempts(String userId, int limit);

    int deleteAttemptsForUser(String userId);
}
