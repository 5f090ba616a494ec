package com.iptvcheck.validator.infrastructure.persistence.repository;

import com.iptvcheck.validator.infrastructure.persistence.dao.FixedPlaylistDao;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

/**
 * Spring Data JPA repository for corrected playlists.
 */
@Repository
public interface FixedPlaylistJpaRepository extends JpaRepository<FixedPlaylistDao, String> {

    /**
     * Bulk delete of playlists created before the cutoff.
     */
    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM FixedPlaylistDao f WHERE f.createdAt < :cutoff")
    int deleteByCreatedAtBefore(@Param("cutoff") Instant cutoff);
}
