package com.asrayaos.firstflame.seeding;

/**
 * Entry point the hosting platform invokes. Safe to call repeatedly and concurrently
 * for the same user, and concurrently across users.
 */
public interface SeedingService {

    /**
     * Seeds or repairs the First-Flame state of one user.
     *
     * @param userId the user id, a UUID
     * @return the terminal outcome of the run
     */
    SeedingOutcome runSeeding(String userId);
}
