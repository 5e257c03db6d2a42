package com.prospect.leadengine.qualify.jobchange;

import java.util.List;

public record PollSummary(
    boolean executed,
    int selected,
    int checked,
    int noData,
    int failed,
    List<JobChangeEvent> changes
) {
    public PollSummary {
        changes = changes == null ? List.of() : List.copyOf(changes);
    }

    public static PollSummary skipped() {
        return new PollSummary(false, 0, 0, 0, 0, List.of());
    }
}
