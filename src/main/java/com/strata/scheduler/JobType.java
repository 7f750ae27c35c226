package com.strata.scheduler;

/**
 * Kinds of work coordinated by the {@link LifecycleScheduler}.
 *
 * Destructive types remove or replace live data and run under the write side
 * of the exclusion lock; everything else shares the read side.
 */
public enum JobType {
    CLEANUP(true, true),
    ARCHIVE(true, true),
    BACKUP(false, true),
    BACKUP_PRUNE(true, true),
    STORAGE_CHECK(false, true),
    VIEW_REFRESH(false, true),
    RESTORE(true, false),
    POLICY_MUTATION(true, false);

    private final boolean destructive;
    private final boolean periodic;

    JobType(boolean destructive, boolean periodic) {
        this.destructive = destructive;
        this.periodic = periodic;
    }

    public boolean isDestructive() {
        return destructive;
    }

    /**
     * Periodic types run on an interval; the others only run when requested.
     */
    public boolean isPeriodic() {
        return periodic;
    }
}
