package com.example.fundraisingdashboard.service.handler;

import com.example.fundraisingdashboard.model.TableName;
import com.example.fundraisingdashboard.store.TabularStore;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;

@Component
public class SchoolTableHandler extends TableHandler {

    public SchoolTableHandler(TabularStore store, Clock clock) {
        super(store, clock);
    }

    @Override
    public TableName table() {
        return TableName.SCHOOLS;
    }

    @Override
    protected String idPrefix() {
        return "school";
    }

    @Override
    protected void validate(Map<String, String> record) {
        requirePresent(record, "name");
    }
}
