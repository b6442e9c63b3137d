package com.hpcwatch.history;

import com.hpcwatch.model.HealthSample;

import java.util.List;
import java.util.Optional;

public class SeverityMergeRule implements MergeRule<HealthSample, Optional<HealthSample>> {

    @Override
    public Optional<HealthSample> merge(List<HealthSample> newestFirst) {
        HealthSample selected = null;
        for (HealthSample sample : newestFirst) {
            if (!sample.isKnown()) {
                continue;
            }
            if (selected == null || sample.getStatus().severity() > selected.getStatus().severity()) {
                selected = sample;
            }
        }
        return Optional.ofNullable(selected);
    }
}
