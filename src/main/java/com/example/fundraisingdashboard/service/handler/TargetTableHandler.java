package com.example.fundraisingdashboard.service.handler;

import com.example.fundraisingdashboard.model.TableName;
import com.example.fundraisingdashboard.store.TabularStore;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;

/**
 * State fundraising targets, keyed by state code and fiscal year.
 */
@Component
public class TargetTableHandler extends TableHandler {

    public TargetTableHandler(TabularStore store, Clock clock) {
        super(store, clock);
    }

    @Override
    public TableName table() {
        return TableName.TARGETS;
    }

    @Override
    protected void applyDefaults(Map<String, String> record) {
        if (isBlank(record.get("targetAmount"))) {
            record.put("targetAmount", "0");
        }
    }

    @Override
    protected void validate(Map<String, String> record) {
        requireNumber(record, "targetAmount");
        String fiscalYear = record.get("fiscalYear");
        if (!isBlank(fiscalYear) && !fiscalYear.matches("FY\\d{2}-\\d{2}")) {
            throw new IllegalArgumentException("fiscalYear must look like FY24-25, got '" + fiscalYear + "'");
        }
    }
}
