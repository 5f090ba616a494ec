package com.iptvcheck.validator.application.port;

import java.time.Instant;
import java.util.Optional;

/**
 * Storage for corrected playlists awaiting download. Storage plugs into here for the actual implementation.
 * This abstraction keeps the analysis independent of where corrected output is kept.
 */
public interface FixedPlaylistPort {

    /**
     * Stores a corrected playlist under a newly generated identifier.
     *
     * @param content the corrected playlist bytes
     * @return the identifier to retrieve the content with
     */
    String put(byte[] content);

    /**
     * Finds a stored playlist.
     *
     * @param id the identifier returned by {@link #put}
     * @return the stored bytes, or empty when nothing is stored under the id
     */
    Optional<byte[]> get(String id);

    /**
     * Removes every playlist stored before the cutoff.
     *
     * @param cutoff playlists created strictly before this instant are removed
     * @return the number of playlists removed
     */
    int deleteOlderThan(Instant cutoff);
}
