package com.example.blobdelete.service;

import java.util.List;

/**
 * Outcomes of a run, in input order.
 */
public record DeletionReport(List<DeletionOutcome> outcomes) {

    public DeletionReport {
        outcomes = List.copyOf(outcomes);
    }

    public long deletedCount() {
        return outcomes.stream().filter(DeletionOutcome::isDeleted).count();
    }

    public List<DeletionOutcome> failures() {
        return outcomes.stream().filter(outcome -> !outcome.isDeleted()).toList();
    }

    public boolean hasFailures() {
        return outcomes.stream().anyMatch(outcome -> !outcome.isDeleted());
    }
}
