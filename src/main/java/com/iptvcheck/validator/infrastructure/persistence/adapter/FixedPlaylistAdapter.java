package com.iptvcheck.validator.infrastructure.persistence.adapter;

import com.iptvcheck.validator.application.port.FixedPlaylistPort;
import com.iptvcheck.validator.infrastructure.persistence.dao.FixedPlaylistDao;
import com.iptvcheck.validator.infrastructure.persistence.repository.FixedPlaylistJpaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Adapter implementing FixedPlaylistPort using Spring Data JPA.
 * Every stored playlist gets a fresh random id, so an id only ever has one writer.
 */
@Component
public class FixedPlaylistAdapter implements FixedPlaylistPort {

    private static final Logger log = LoggerFactory.getLogger(FixedPlaylistAdapter.class);

    private final FixedPlaylistJpaRepository jpaRepository;

    public FixedPlaylistAdapter(FixedPlaylistJpaRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }

    @Override
    public String put(byte[] content) {
        String id = UUID.randomUUID().toString();
        jpaRepository.save(new FixedPlaylistDao(id, content, Instant.now()));
        log.info("Stored corrected playlist {} ({} bytes)", id, content.length);
        return id;
    }

    @Override
    public Optional<byte[]> get(String id) {
        return jpaRepository.findById(id).map(FixedPlaylistDao::getContent);
    }

    @Override
    @Transactional
    public int deleteOlderThan(Instant cutoff) {
        return jpaRepository.deleteByCreatedAtBefore(cutoff);
    }
}
