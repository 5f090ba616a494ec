package com.iptvcheck.validator.application.service;

import com.iptvcheck.validator.application.port.FixedPlaylistPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Drops corrected playlists once they are older than {@code iptv-check.fixed-playlist-ttl}.
 */
@Service
public class FixedPlaylistExpiryService {

    private static final Logger log = LoggerFactory.getLogger(FixedPlaylistExpiryService.class);

    private final FixedPlaylistPort fixedPlaylistPort;
    private final Duration timeToLive;

    public FixedPlaylistExpiryService(
            FixedPlaylistPort fixedPlaylistPort,
            @Value("${iptv-check.fixed-playlist-ttl:PT1H}") String timeToLive
    ) {
        this.fixedPlaylistPort = fixedPlaylistPort;
        this.timeToLive = parseTimeToLive(timeToLive);
    }

    /**
     * @param now the current instant
     * @return the number of playlists removed
     */
    public int purgeExpired(Instant now) {
        Instant cutoff = now.minus(timeToLive);
        int removed = fixedPlaylistPort.deleteOlderThan(cutoff);
        if (removed > 0) {
            log.info("Removed {} corrected playlists stored before {}", removed, cutoff);
        }
        return removed;
    }

    public Duration getTimeToLive() {
        return timeToLive;
    }

    private static Duration parseTimeToLive(String value) {
        Duration parsed;
        try {
            parsed = Duration.parse(value.strip());
        } catch (DateTimeParseException e) {
            throw new IllegalStateException("iptv-check.fixed-playlist-ttl must be an ISO-8601 duration, got '"
                    + value + "'", e);
        }
        if (parsed.isNegative() || parsed.isZero()) {
            throw new IllegalStateException("iptv-check.fixed-playlist-ttl must be positive, got " + value);
        }
        return parsed;
    }
}
