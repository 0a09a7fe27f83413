package com.example.fundraisingdashboard.service;

import com.example.fundraisingdashboard.model.TableName;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class SpringCacheInvalidationNotifier implements CacheInvalidationNotifier {

    public static final String TABLES_CACHE = "tables";

    private final CacheManager cacheManager;

    @Override
    public void tableChanged(TableName table) {
        Cache cache = cacheManager.getCache(TABLES_CACHE);
        if (cache == null) {
            return;
        }
        if (table == TableName.ALL) {
            cache.clear();
            log.debug("Cleared all cached tables");
        } else {
            cache.evict(table.getValue());
            log.debug("Evicted cached table {}", table.getValue());
        }
    }
}
