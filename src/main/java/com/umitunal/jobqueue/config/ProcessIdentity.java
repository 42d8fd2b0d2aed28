package com.umitunal.jobqueue.config;

import java.util.Objects;
import java.util.UUID;

/**
 * Identifies the local process that shares the job store with others
 * (for example a main application and an extension).
 *
 * Records inserted with an exclusive process identifier are only ever
 * claimed by the process carrying that identifier. Only the main process
 * resets orphaned records and prunes stale ones on startup.
 */
public final class ProcessIdentity {
    private final String identifier;
    private final boolean mainProcess;

    private ProcessIdentity(String identifier, boolean mainProcess) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("process identifier must not be empty");
        }
        this.identifier = identifier;
        this.mainProcess = mainProcess;
    }

    public static ProcessIdentity mainProcess(String identifier) {
        return new ProcessIdentity(identifier, true);
    }

    public static ProcessIdentity secondaryProcess(String identifier) {
        return new ProcessIdentity(identifier, false);
    }

    /**
     * A main process with a fresh random identifier.
     */
    public static ProcessIdentity randomMainProcess() {
        return mainProcess(UUID.randomUUID().toString());
    }

    public String getIdentifier() {
        return identifier;
    }

    public boolean isMainProcess() {
        return mainProcess;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProcessIdentity)) return false;
        ProcessIdentity that = (ProcessIdentity) o;
        return mainProcess == that.mainProcess && identifier.equals(that.identifier);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identifier, mainProcess);
    }

    @Override
    public String toString() {
        return String.format("ProcessIdentity{id='%s', main=%s}", identifier, mainProcess);
    }
}
