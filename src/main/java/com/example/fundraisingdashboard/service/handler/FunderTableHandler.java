package com.example.fundraisingdashboard.service.handler;

import com.example.fundraisingdashboard.model.TableName;
import com.example.fundraisingdashboard.store.TabularStore;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;

@Component
public class FunderTableHandler extends TableHandler {

    public FunderTableHandler(TabularStore store, Clock clock) {
        super(store, clock);
    }

    @Override
    public TableName table() {
        return TableName.FUNDERS;
    }

    @Override
    protected String idPrefix() {
        return "funder";
    }

    @Override
    protected void validate(Map<String, String> record) {
        requirePresent(record, "name");
    }
}
