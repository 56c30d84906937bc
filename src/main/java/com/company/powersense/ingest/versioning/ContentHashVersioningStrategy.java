package com.company.powersense.ingest.versioning;

import com.company.powersense.domain.LatestState;
import com.company.powersense.domain.MetricValue;
import com.company.powersense.domain.enums.VersioningMode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Map;
import java.util.OptionalLong;
import java.util.TreeMap;

/**
 * Stateless versioning: the version is a hash of (value, identity key), so re-sending an unchanged
 * value produces the same row and the store's replacing merge collapses it. Versions are positive
 * but carry no ordering.
 * <p>
 * The hash is the first 8 bytes of SHA-256 over the compact JSON {@code {"ukey":...,"value":...}},
 * read big-endian with the sign bit cleared so it fits a signed {@code long}. Writers that derive
 * the version with another digest (an unsigned 64-bit BLAKE2b, for example) produce different
 * versions for the same key and value, so such writers must not share a table with this one.
 */
public class ContentHashVersioningStrategy implements VersioningStrategy {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public VersioningMode mode() {
        return VersioningMode.CONTENT_HASH;
    }

    @Override
    public boolean requiresLatestState() {
        return false;
    }

    @Override
    public OptionalLong nextVersion(String identityKey, MetricValue incoming, LatestState previous) {
        long version = hash(identityKey, incoming);
        // Same key and value already accepted earlier in this batch
        if (previous != null && previous.version() == version) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(version);
    }

    long hash(String identityKey, MetricValue value) {
        Map<String, Object> payload = new TreeMap<>();
        payload.put("ukey", identityKey);
        payload.put("value", value.orNull());

        try {
            byte[] bytes = objectMapper.writeValueAsString(payload).getBytes(StandardCharsets.UTF_8);
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(bytes);
            long folded = ByteBuffer.wrap(digest, 0, Long.BYTES).getLong() & Long.MAX_VALUE;
            return folded == 0 ? 1 : folded;
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new IllegalStateException("Cannot hash version payload for " + identityKey, e);
        }
    }
}
