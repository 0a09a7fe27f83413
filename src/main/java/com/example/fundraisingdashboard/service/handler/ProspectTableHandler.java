package com.example.fundraisingdashboard.service.handler;

import com.example.fundraisingdashboard.model.TableName;
import com.example.fundraisingdashboard.store.TabularStore;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;

@Component
public class ProspectTableHandler extends TableHandler {

    public ProspectTableHandler(TabularStore store, Clock clock) {
        super(store, clock);
    }

    @Override
    public TableName table() {
        return TableName.PROSPECTS;
    }

    @Override
    protected String idPrefix() {
        return "prospect";
    }

    @Override
    protected void applyDefaults(Map<String, String> record) {
        if (isBlank(record.get("stage"))) {
            record.put("stage", "Lead");
        }
        if (isBlank(record.get("estimatedAmount"))) {
            record.put("estimatedAmount", "0");
        }
        if (isBlank(record.get("probability"))) {
            record.put("probability", "0");
        }
    }

    /**
     * Probability is a fraction in [0, 1].
     */
    @Override
    protected void validate(Map<String, String> record) {
        requireNumber(record, "estimatedAmount");
        requireNumber(record, "probability");
        String probability = record.get("probability");
        if (!isBlank(probability)) {
            double p = Double.parseDouble(probability);
            if (p < 0 || p > 1) {
                throw new IllegalArgumentException("probability must be between 0 and 1, got " + probability);
            }
        }
    }
}
