package com.company.powersense.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bucket table computed for a single detection cycle. Never persisted.
 */
public class Baseline {

    private static final Baseline EMPTY = new Baseline(List.of(), 0);

    private final Map<BucketKey, BaselineBucket> buckets;
    private final int minSamples;

    public Baseline(Collection<BaselineBucket> buckets, int minSamples) {
        Map<BucketKey, BaselineBucket> byKey = new LinkedHashMap<>();
        for (BaselineBucket bucket : buckets) {
            byKey.put(bucket.key(), bucket);
        }
        this.buckets = Collections.unmodifiableMap(byKey);
        this.minSamples = minSamples;
    }

    public static Baseline empty() {
        return EMPTY;
    }

    public Optional<BaselineBucket> find(BucketKey key) {
        return Optional.ofNullable(buckets.get(key));
    }

    /**
     * Bucket usable for scoring: enough samples and a defined, non-zero standard deviation.
     */
    public Optional<BaselineBucket> findScorable(BucketKey key) {
        return find(key).filter(bucket -> bucket.isScorable(minSamples));
    }

    public Collection<BaselineBucket> buckets() {
        return buckets.values();
    }

    public int size() {
        return buckets.size();
    }

    public boolean isEmpty() {
        return buckets.isEmpty();
    }
}
