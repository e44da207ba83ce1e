package com.valkyrlabs.gruff.version;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.UUID;

import com.valkyrlabs.model.VersionedResource;

/**
 * Keyset position in a newest-first listing: the {@code createdAt} and
 * {@code id} of the last row already returned. The next page holds rows ordered
 * strictly after it.
 *
 * <p>
 * The token form is {@code <ISO-8601 instant>:<uuid>}.
 * </p>
 */
public final class PageCursor {

    private final Instant createdAt;
    private final UUID id;

    public PageCursor(Instant createdAt, UUID id) {
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.id = Objects.requireNonNull(id, "id");
    }

    public static PageCursor after(VersionedResource row) {
        return new PageCursor(row.getCreatedAt(), row.getId());
    }

    /**
     * @throws IllegalArgumentException if {@code token} is not a cursor token
     */
    public static PageCursor parse(String token) {
        int split = token == null ? -1 : token.lastIndexOf(':');
        if (split < 1) {
            throw new IllegalArgumentException("Invalid cursor: " + token);
        }
        try {
            return new PageCursor(Instant.parse(token.substring(0, split)), UUID.fromString(token.substring(split + 1)));
        } catch (DateTimeParseException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid cursor: " + token, e);
        }
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public UUID getId() {
        return id;
    }

    public String toToken() {
        return createdAt + ":" + id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PageCursor)) {
            return false;
        }
        PageCursor other = (PageCursor) o;
        return createdAt.equals(other.createdAt) && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(createdAt, id);
    }

    @Override
    public String toString() {
        return toToken();
    }
}
