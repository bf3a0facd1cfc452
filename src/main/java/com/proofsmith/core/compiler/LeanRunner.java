package com.proofsmith.core.compiler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the Lean compiler ({@code lake lean <file>} by default) on a source file written
 * into the playground directory. The file is removed after every invocation,
 * including timeouts and launch failures.
 */
@Component
public class LeanRunner implements ProofChecker {

    private static final Logger log = LoggerFactory.getLogger(LeanRunner.class);

    private static final long STREAM_JOIN_MS = 1000;

    private final Path         playgroundDir;
    private final Path         projectDir;
    private final List<String> command;
    private final int          timeoutSeconds;

    @Autowired
    public LeanRunner(
            @Value("${proofsmith.lean.playground-dir:lean_playground}") String playgroundDir,
            @Value("${proofsmith.lean.project-dir:.}") String projectDir,
            @Value("${proofsmith.lean.command:lake lean}") String command,
            @Value("${proofsmith.lean.timeout-seconds:60}") int timeoutSeconds
    ) {
        this(Path.of(playgroundDir), Path.of(projectDir),
                Arrays.asList(command.trim().split("\\s+")), timeoutSeconds);
    }

    public LeanRunner(Path playgroundDir, Path projectDir, List<String> command, int timeoutSeconds) {
        if (command.isEmpty() || command.get(0).isBlank()) {
            throw new IllegalArgumentException("Compiler command must not be empty");
        }
        if (timeoutSeconds < 1) {
            throw new IllegalArgumentException("timeout-seconds must be >= 1, got " + timeoutSeconds);
        }
        this.playgroundDir  = playgroundDir;
        this.projectDir     = projectDir;
        this.command        = List.copyOf(command);
        this.timeoutSeconds = timeoutSeconds;

        log.info("[LeanRunner] Playground: {}", playgroundDir.toAbsolutePath());
        log.info("[LeanRunner] Command: {} (timeout {}s)", String.join(" ", this.command), timeoutSeconds);
    }

    @Override
    public CompilationResult execute(String source, String fileName) {

        long startTime = System.currentTimeMillis();
        Path file = playgroundDir.resolve(fileName);

        try {
            Files.createDirectories(playgroundDir);
            Files.writeString(file, source, StandardCharsets.UTF_8);
            return runCompiler(file, startTime);

        } catch (IOException e) {
            log.error("[LeanRunner] Could not write {}: {}", file, e.getMessage());
            return CompilationResult.failure(e.getMessage(), System.currentTimeMillis() - startTime);

        } finally {
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                log.warn("[LeanRunner] Could not delete {}: {}", file, e.getMessage());
            }
        }
    }

    private CompilationResult runCompiler(Path file, long startTime) {

        List<String> fullCommand = new ArrayList<>(command);
        fullCommand.add(file.toAbsolutePath().toString());
        log.info("[LeanRunner] Executing: {}", String.join(" ", fullCommand));

        Process process;
        try {
            ProcessBuilder builder = new ProcessBuilder(fullCommand);
            builder.directory(projectDir.toFile());
            process = builder.start();
        } catch (IOException e) {
            log.error("[LeanRunner] Launch failed: {}", e.getMessage());
            return CompilationResult.failure(e.getMessage(), System.currentTimeMillis() - startTime);
        }

        // Lean keeps stdout and stderr separate; drain both so neither pipe fills up
        StringBuffer stdout = new StringBuffer();
        StringBuffer stderr = new StringBuffer();
        Thread outThread = drain(process.getInputStream(), stdout, "stdout");
        Thread errThread = drain(process.getErrorStream(), stderr, "stderr");

        try {
            boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);

            if (!finished) {
                process.destroyForcibly();
                log.warn("[LeanRunner] Process timed out after {} seconds", timeoutSeconds);
                return CompilationResult.timeout(timeoutSeconds, stdout.toString(),
                        System.currentTimeMillis() - startTime);
            }

            outThread.join(STREAM_JOIN_MS);
            errThread.join(STREAM_JOIN_MS);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return CompilationResult.failure("interrupted", System.currentTimeMillis() - startTime);
        }

        int exitCode = process.exitValue();
        log.info("[LeanRunner] Exit code: {}, stdout {} chars, stderr {} chars",
                exitCode, stdout.length(), stderr.length());

        return new CompilationResult(exitCode, stdout.toString(), stderr.toString(),
                System.currentTimeMillis() - startTime);
    }

    private Thread drain(InputStream stream, StringBuffer sink, String name) {
        Thread thread = new Thread(() -> {
            try (BufferedReader reader =
                         new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    sink.append(line).append("\n");
                }
            } catch (IOException e) {
                log.warn("[LeanRunner] Error reading {}: {}", name, e.getMessage());
            }
        }, "lean-" + name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    public Path getPlaygroundDir() {
        return playgroundDir;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }
}
