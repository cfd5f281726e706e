package com.sessiongate.backend.modules.auth.infrastructure.redis;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Keeps at most one session marker per user. A marker is what makes a user's
 * tokens usable: deleting it revokes every outstanding access and refresh token
 * for that user.
 *
 * <p>Implementations must be safe for concurrent use. Every operation throws
 * {@link SessionStoreUnavailableException} when the backing store cannot be reached.
 */
public interface SessionStore {

    /**
     * Creates or overwrites the marker for {@code userId}. Markers never expire on their own.
     */
    void putMarker(String userId);

    /**
     * @return the stored marker value, or empty if the user has no session
     */
    Optional<String> findMarker(String userId);

    /**
     * @return {@code true} if a marker existed and was removed
     */
    boolean deleteMarker(String userId);

    /**
     * Walks every marker in pages and hands the user id part of each key to {@code action}.
     * Markers created or deleted during the walk may or may not be visited.
     */
    void scanMarkers(Consumer<String> action);
}
