package com.code.quality.analyzer;

import com.code.quality.core.model.ParsedFile;

import java.util.List;

/**
 * Ordered list of analyzer tasks produced by {@link AnalyzerRegistry#plan}.
 * Each unit appears at most once, paired with the files in languages it supports.
 *
 * @param tasks tasks in ascending priority tier
 */
public record ExecutionPlan(List<PlannedTask> tasks) {

    public ExecutionPlan {
        tasks = List.copyOf(tasks);
    }

    public static ExecutionPlan empty() {
        return new ExecutionPlan(List.of());
    }

    public int size() {
        return tasks.size();
    }

    public boolean isEmpty() {
        return tasks.isEmpty();
    }

    /**
     * One unit together with the file subset it will analyze.
     */
    public record PlannedTask(AnalyzerUnit unit, AnalyzerPriority priority, List<ParsedFile> files) {
        public PlannedTask {
            files = List.copyOf(files);
        }
    }
}
