package com.hpcwatch.scheduler;

import java.util.List;

public record RefreshReport(List<KeyOutcome> outcomes) {

    public RefreshReport {
        outcomes = List.copyOf(outcomes);
    }

    public static RefreshReport of(List<KeyOutcome> outcomes) {
        return new RefreshReport(outcomes);
    }

    public List<String> written() {
        return outcomes.stream().filter(KeyOutcome::written).map(KeyOutcome::key).toList();
    }

    public List<String> failed() {
        return outcomes.stream().filter(o -> !o.written()).map(KeyOutcome::key).toList();
    }

    public JobOutcome outcome() {
        long failed = outcomes.stream().filter(o -> !o.written()).count();
        if (failed == 0) {
            return JobOutcome.SUCCEEDED;
        }
        return failed == outcomes.size() ? JobOutcome.FAILED : JobOutcome.PARTIAL;
    }

    public record KeyOutcome(String key, boolean written, String error) {

        public static KeyOutcome written(String key) {
            return new KeyOutcome(key, true, null);
        }

        public static KeyOutcome failed(String key, String error) {
            return new KeyOutcome(key, false, error);
        }
    }
}
