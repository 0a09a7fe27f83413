package com.example.fundraisingdashboard.service;

import com.example.fundraisingdashboard.model.TableName;

/**
 * Tells read-side caches that a table changed. {@link TableName#ALL} means every table.
 */
public interface CacheInvalidationNotifier {

    void tableChanged(TableName table);
}
