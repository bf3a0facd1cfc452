package com.proofsmith.benchmark;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Component
public class TaskSuiteLoader {

    private static final Logger log = LoggerFactory.getLogger(TaskSuiteLoader.class);

    static final String TASK_PREFIX      = "task_id_";
    static final String DESCRIPTION_FILE = "description.txt";
    static final String TEMPLATE_FILE    = "task.lean";
    static final String TESTS_FILE       = "tests.lean";

    private final Path tasksDir;

    public TaskSuiteLoader(@Value("${proofsmith.benchmark.tasks-dir:tasks}") String tasksDir) {
        this.tasksDir = Path.of(tasksDir);
    }

    /** {@code task_id_*} directories in name order; empty when the tasks directory is missing. */
    public List<Path> discover() {
        if (!Files.isDirectory(tasksDir)) {
            log.warn("[Benchmark] Tasks directory {} not found", tasksDir);
            return List.of();
        }

        try (Stream<Path> stream = Files.list(tasksDir)) {
            return stream
                    .filter(Files::isDirectory)
                    .filter(p -> p.getFileName().toString().startsWith(TASK_PREFIX))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.error("[Benchmark] Could not list {}: {}", tasksDir, e.getMessage());
            return List.of();
        }
    }

    /**
     * Loads a task by id. The id must name a {@code task_id_*} directory directly inside
     * the tasks directory.
     *
     * @return the task, or null when the id is malformed, or its directory or a required
     *         file is missing or unreadable
     */
    public BenchmarkTask load(String taskId) {
        Path taskDir = resolveTaskDir(taskId);
        if (taskDir == null) {
            log.warn("[Benchmark] Rejected task id {}", taskId);
            return null;
        }
        if (!Files.isDirectory(taskDir)) {
            log.warn("[Benchmark] Task {} not found", taskId);
            return null;
        }
        return load(taskDir);
    }

    private Path resolveTaskDir(String taskId) {
        if (taskId == null || !taskId.startsWith(TASK_PREFIX)) {
            return null;
        }
        Path base = tasksDir.toAbsolutePath().normalize();
        Path resolved;
        try {
            resolved = base.resolve(taskId).normalize();
        } catch (InvalidPathException e) {
            return null;
        }
        if (!base.equals(resolved.getParent())) {
            return null;
        }
        return resolved;
    }

    public BenchmarkTask load(Path taskDir) {
        Path descFile = taskDir.resolve(DESCRIPTION_FILE);
        Path taskFile = taskDir.resolve(TEMPLATE_FILE);
        Path testFile = taskDir.resolve(TESTS_FILE);

        if (!Files.isRegularFile(descFile)) {
            log.warn("[Benchmark] Missing {} in {}", DESCRIPTION_FILE, taskDir);
            return null;
        }
        if (!Files.isRegularFile(taskFile)) {
            log.warn("[Benchmark] Missing {} in {}", TEMPLATE_FILE, taskDir);
            return null;
        }

        try {
            String description = Files.readString(descFile, StandardCharsets.UTF_8).strip();
            String template    = Files.readString(taskFile, StandardCharsets.UTF_8);
            String tests       = Files.isRegularFile(testFile)
                    ? Files.readString(testFile, StandardCharsets.UTF_8)
                    : "";
            return new BenchmarkTask(taskDir.getFileName().toString(), description, template, tests, taskDir);

        } catch (IOException e) {
            log.error("[Benchmark] Error loading task {}: {}", taskDir, e.getMessage());
            return null;
        }
    }

    public List<BenchmarkTask> loadAll() {
        List<BenchmarkTask> tasks = new ArrayList<>();
        for (Path dir : discover()) {
            BenchmarkTask task = load(dir);
            if (task != null) {
                tasks.add(task);
            }
        }
        return tasks;
    }

    public Path getTasksDir() {
        return tasksDir;
    }
}
