package com.company.signals.service;

import com.company.signals.config.RedisCacheConfig;
import com.company.signals.event.IssueTriagedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

@Service
@Slf4j
@RequiredArgsConstructor
public class IssueCacheEvictionService {

    private final CacheManager cacheManager;

    /**
     * An auto-resolved issue drops out of unresolved listings, so cached lists are stale
     */
    @EventListener
    @Async
    public void onIssueTriaged(IssueTriagedEvent event) {
        if (!event.isAutoResolved()) {
            return;
        }
        Cache issues = cacheManager.getCache(RedisCacheConfig.PROJECT_ISSUES_CACHE);
        if (issues != null) {
            issues.clear();
            log.debug("Cleared {} cache after auto-resolving issue {}",
                    RedisCacheConfig.PROJECT_ISSUES_CACHE, event.getIssueId());
        }
    }
}
