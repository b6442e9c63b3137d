package com.hpcwatch.history;

import com.hpcwatch.model.PowerSample;

import java.util.List;

public class RecentNonZeroMergeRule implements MergeRule<PowerSample, Long> {

    @Override
    public Long merge(List<PowerSample> newestFirst) {
        for (PowerSample sample : newestFirst) {
            if (sample.watts() > 0) {
                return sample.watts();
            }
        }
        return 0L;
    }
}
