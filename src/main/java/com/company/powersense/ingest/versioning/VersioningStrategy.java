package com.company.powersense.ingest.versioning;

import com.company.powersense.domain.LatestState;
import com.company.powersense.domain.MetricValue;
import com.company.powersense.domain.enums.VersioningMode;

import java.util.OptionalLong;

/**
 * Decides whether an incoming value becomes a new row and which version it gets.
 */
public interface VersioningStrategy {

    VersioningMode mode();

    /**
     * Whether {@link #nextVersion} needs the stored latest state; when false the reconciler
     * skips the read before write.
     */
    boolean requiresLatestState();

    /**
     * @param previous latest known state for the key, stored or assigned earlier in the batch;
     *                 null when the key has never been seen
     * @return the version to write, or empty when the value carries no new information
     */
    OptionalLong nextVersion(String identityKey, MetricValue incoming, LatestState previous);
}
