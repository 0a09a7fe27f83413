package com.example.fundraisingdashboard.service;

import com.example.fundraisingdashboard.model.TableName;
import com.example.fundraisingdashboard.store.TableRows;
import com.example.fundraisingdashboard.store.TabularStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Cached read access for dashboards. Entries are evicted by {@link SpringCacheInvalidationNotifier}
 * whenever the pipeline writes to a table.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TableQueryService {

    private final TabularStore store;

    @Cacheable(cacheNames = SpringCacheInvalidationNotifier.TABLES_CACHE, key = "#table.value")
    public List<Map<String, String>> records(TableName table) {
        log.debug("Loading {} from the store", table.getValue());
        return TableRows.liveRecords(table, store.getRows(table));
    }
}
