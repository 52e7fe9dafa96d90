package com.motaz.fraudscan.services;

import com.motaz.fraudscan.model.documents.AlertPreferenceDocument;
import com.motaz.fraudscan.model.entities.UserSettingsEntity;
import com.motaz.fraudscan.repositories.AlertPreferenceDocumentRepository;
import com.motaz.fraudscan.repositories.UserSettingsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import redis.clients.jedis.exceptions.JedisException;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

@Slf4j
@Service
@RequiredArgsConstructor
public class AlertPreferenceService {

    private final AlertPreferenceDocumentRepository alertPreferenceDocumentRepository;
    private final UserSettingsRepository userSettingsRepository;

    @Transactional(readOnly = true)
    public long cacheAlertPreferences() {
        AtomicLong cached = new AtomicLong();
        try (Stream<UserSettingsEntity> settingsStream = userSettingsRepository.findAllBy()) {
            settingsStream
                    .filter(settings -> settings.getAlertThreshold() != null)
                    .forEach(settings -> {
                        alertPreferenceDocumentRepository.save(AlertPreferenceDocument.builder()
                                .id("user:" + settings.getUserId())
                                .userId(settings.getUserId())
                                .alertThreshold(settings.getAlertThreshold())
                                .build());
                        cached.incrementAndGet();
                    });
        }
        log.info("{} alert preferences cached in Redis..", cached.get());
        return cached.get();
    }

    /**
     * The caller's stored alert threshold. A preference store that cannot be
     * reached counts as "no preference" so a scan still runs on the default.
     * Indexed lookups go through Jedis directly, so its exceptions arrive
     * untranslated.
     */
    public Optional<Integer> findThreshold(String userId) {
        if (userId == null || userId.isBlank()) {
            return Optional.empty();
        }
        try {
            return alertPreferenceDocumentRepository.findByUserId(userId)
                    .map(AlertPreferenceDocument::getAlertThreshold);
        } catch (DataAccessException | JedisException e) {
            log.warn("Alert preference lookup failed for user {}, using default threshold: {}", userId, e.getMessage());
            return Optional.empty();
        }
    }
}
