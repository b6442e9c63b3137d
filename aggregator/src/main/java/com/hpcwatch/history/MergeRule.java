package com.hpcwatch.history;

import java.util.List;

@FunctionalInterface
public interface MergeRule<S, M> {

    M merge(List<S> newestFirst);
}
