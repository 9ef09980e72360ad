package com.example.SmartDairy.client;

import java.nio.file.Path;

/**
 * Runs an analysis over a farm data file and returns a human-readable summary.
 * The shape of the summary (statistics, grouped aggregates, preview) is the executor's choice.
 */
public interface TabularExecutor {

    String analyze(Path filePath, String query);
}
