package com.iptvcheck.validator.application.config;

import com.iptvcheck.validator.application.service.FixedPlaylistExpiryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;

@Component
public class FixedPlaylistPurgeScheduler {

    private static final Logger log = LoggerFactory.getLogger(FixedPlaylistPurgeScheduler.class);

    private final FixedPlaylistExpiryService expiryService;

    public FixedPlaylistPurgeScheduler(FixedPlaylistExpiryService expiryService) {
        this.expiryService = expiryService;
    }

    @Scheduled(
            initialDelayString = "${iptv-check.fixed-playlist-purge-interval:PT10M}",
            fixedDelayString = "${iptv-check.fixed-playlist-purge-interval:PT10M}"
    )
    public void purgeExpiredPlaylists() {
        try {
            expiryService.purgeExpired(Instant.now());
        } catch (RuntimeException e) {
            // the next run retries
            log.warn("Corrected playlist purge failed: {}", e.getMessage(), e);
        }
    }
}
