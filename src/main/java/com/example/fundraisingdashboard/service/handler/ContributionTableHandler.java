package com.example.fundraisingdashboard.service.handler;

import com.example.fundraisingdashboard.model.TableName;
import com.example.fundraisingdashboard.store.TabularStore;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Map;

@Component
public class ContributionTableHandler extends TableHandler {

    public ContributionTableHandler(TabularStore store, Clock clock) {
        super(store, clock);
    }

    @Override
    public TableName table() {
        return TableName.CONTRIBUTIONS;
    }

    @Override
    protected String idPrefix() {
        return "contrib";
    }

    @Override
    protected void applyDefaults(Map<String, String> record) {
        if (isBlank(record.get("amount"))) {
            record.put("amount", "0");
        }
        if (isBlank(record.get("date"))) {
            record.put("date", LocalDate.now(clock).toString());
        }
    }

    @Override
    protected void validate(Map<String, String> record) {
        requireNumber(record, "amount");
        String amount = record.get("amount");
        if (isBlank(amount)) {
            return;
        }
        if (Double.parseDouble(amount.replace(",", "")) < 0) {
            throw new IllegalArgumentException("amount must not be negative");
        }
    }
}
