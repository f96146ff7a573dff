package com.purchasingpower.signalintel.service.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Removes expired cache entries on the {@code app.cache.purge-cron} schedule.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CacheExpiryJob {

    private final ResultCache resultCache;

    @Scheduled(cron = "${app.cache.purge-cron:0 15 * * * *}")
    public void purgeExpired() {
        try {
            int removed = resultCache.purgeExpired();
            if (removed > 0) {
                log.info("🧹 Purged {} expired cache entries", removed);
            }
        } catch (RuntimeException e) {
            log.warn("⚠️ Cache purge failed, will retry next run: {}", e.getMessage());
        }
    }
}
