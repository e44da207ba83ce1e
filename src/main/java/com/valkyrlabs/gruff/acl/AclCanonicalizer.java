package com.valkyrlabs.gruff.acl;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.valkyrlabs.model.AclPermission;

/**
 * Canonical form of an ACL entry list.
 *
 * <p>
 * Two entry lists that grant the same effective permissions, in any order and with
 * any redundancy, reduce to the same {@link #deduplicate deduplicated} set and the
 * same {@link #computeHash hash}. The hash is the SHA-256 hex digest of the JSON
 * array of entries sorted by principal type, principal id and permission.
 * </p>
 */
public final class AclCanonicalizer {

    public static final Comparator<AclGrant> CANONICAL_ORDER = Comparator
            .comparing((AclGrant g) -> g.getPrincipalType().getValue())
            .thenComparing(g -> g.getPrincipalId().toString())
            .thenComparing(g -> g.getPermission().getValue());

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private AclCanonicalizer() {
    }

    /**
     * Drops exact duplicates, then drops every READ entry whose principal also holds
     * WRITE. First-seen order of the survivors is kept.
     */
    public static List<AclGrant> deduplicate(Collection<AclGrant> entries) {
        List<AclGrant> unique = new ArrayList<>(new LinkedHashSet<>(entries));
        List<AclGrant> result = new ArrayList<>(unique.size());
        for (AclGrant grant : unique) {
            if (grant.getPermission() == AclPermission.READ && holdsWrite(unique, grant)) {
                continue;
            }
            result.add(grant);
        }
        return result;
    }

    /**
     * Order-independent digest of {@code entries}. Callers deduplicate first; this
     * method only sorts.
     */
    public static String computeHash(Collection<AclGrant> entries) {
        List<AclGrant> sorted = sorted(entries);
        String canonical;
        try {
            canonical = MAPPER.writeValueAsString(sorted);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("ACL entries could not be serialized", e);
        }
        return sha256(canonical);
    }

    public static List<AclGrant> sorted(Collection<AclGrant> entries) {
        List<AclGrant> sorted = new ArrayList<>(entries);
        sorted.sort(CANONICAL_ORDER);
        return sorted;
    }

    private static boolean holdsWrite(List<AclGrant> entries, AclGrant read) {
        for (AclGrant other : entries) {
            if (other.getPermission() == AclPermission.WRITE && other.samePrincipal(read)) {
                return true;
            }
        }
        return false;
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
