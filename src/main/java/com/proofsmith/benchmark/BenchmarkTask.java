package com.proofsmith.benchmark;

import java.nio.file.Path;

/**
 * One {@code task_id_*} directory: description.txt, task.lean and an optional tests.lean.
 */
public class BenchmarkTask {

    private final String taskId;
    private final String description;
    private final String template;
    private final String tests;
    private final Path   taskDir;

    public BenchmarkTask(String taskId, String description, String template, String tests, Path taskDir) {
        this.taskId      = taskId;
        this.description = description;
        this.template    = template;
        this.tests       = tests != null ? tests : "";
        this.taskDir     = taskDir;
    }

    public String getTaskId() {
        return taskId;
    }

    public String getDescription() {
        return description;
    }

    public String getTemplate() {
        return template;
    }

    public String getTests() {
        return tests;
    }

    public Path getTaskDir() {
        return taskDir;
    }
}
