package com.summaryplatform.common.exception;

import java.util.List;

/**
 * The summarization service graph contains a cycle. This is a wiring bug, not
 * a data condition.
 */
public class CyclicDependencyException extends SummarizationException {
    private final List<String> cycle;

    public CyclicDependencyException(String component, List<String> cycle) {
        super(component, "Cyclic service dependency: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }
}
