package com.company.powersense.ingest.versioning;

import com.company.powersense.domain.LatestState;
import com.company.powersense.domain.MetricValue;
import com.company.powersense.domain.enums.VersioningMode;

import java.util.OptionalLong;

/**
 * Versions 1, 2, 3 ... per key, a new version only when the value differs from the latest one.
 * An absent value is comparable: absent after absent is unchanged, a first-ever absent value is version 1.
 */
public class SequentialVersioningStrategy implements VersioningStrategy {

    @Override
    public VersioningMode mode() {
        return VersioningMode.SEQUENTIAL;
    }

    @Override
    public boolean requiresLatestState() {
        return true;
    }

    @Override
    public OptionalLong nextVersion(String identityKey, MetricValue incoming, LatestState previous) {
        if (previous == null) {
            return OptionalLong.of(1L);
        }
        if (previous.value().equals(incoming)) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(previous.version() + 1);
    }
}
