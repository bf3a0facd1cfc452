package com.proofsmith.benchmark;

import com.proofsmith.orchestrator.ProofOrchestrator;
import com.proofsmith.orchestrator.ProofSolution;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class TaskSuiteLoaderTest {

    @TempDir
    Path tasksDir;

    private TaskSuiteLoader loader;

    @BeforeEach
    void setUp() throws Exception {
        writeTask("task_id_1", "  Add two numbers \n", "def add := {{code}} -- {{proof}}", "#eval add");
        writeTask("task_id_0", "Return the minimum", "def m := {{code}} -- {{proof}}", null);
        Files.createDirectories(tasksDir.resolve("task_id_2"));
        Files.writeString(tasksDir.resolve("task_id_2").resolve(TaskSuiteLoader.DESCRIPTION_FILE), "no template");
        Files.createDirectories(tasksDir.resolve("scratch"));

        loader = new TaskSuiteLoader(tasksDir.toString());
    }

    private void writeTask(String id, String description, String template, String tests) throws Exception {
        Path dir = Files.createDirectories(tasksDir.resolve(id));
        Files.writeString(dir.resolve(TaskSuiteLoader.DESCRIPTION_FILE), description);
        Files.writeString(dir.resolve(TaskSuiteLoader.TEMPLATE_FILE), template);
        if (tests != null) {
            Files.writeString(dir.resolve(TaskSuiteLoader.TESTS_FILE), tests);
        }
    }

    @Test
    void testDiscoverFindsTaskDirectoriesInOrder() {
        List<Path> dirs = loader.discover();

        assertEquals(3, dirs.size());
        assertEquals("task_id_0", dirs.get(0).getFileName().toString());
        assertEquals("task_id_2", dirs.get(2).getFileName().toString());
    }

    @Test
    void testLoadReadsAllFiles() {
        BenchmarkTask task = loader.load("task_id_1");

        assertNotNull(task);
        assertEquals("task_id_1", task.getTaskId());
        assertEquals("Add two numbers", task.getDescription());
        assertEquals("def add := {{code}} -- {{proof}}", task.getTemplate());
        assertEquals("#eval add", task.getTests());
    }

    @Test
    void testMissingTestsFileIsAllowed() {
        assertEquals("", loader.load("task_id_0").getTests());
    }

    @Test
    void testIncompleteOrUnknownTaskIsNull() {
        assertNull(loader.load("task_id_2"));
        assertNull(loader.load("task_id_99"));
    }

    @Test
    void testTaskIdMustNameDirectChildOfTasksDirectory() throws Exception {
        writeTask("task_id_out", "Outside the suite", "def o := {{code}} -- {{proof}}", null);
        Path suiteDir = Files.createDirectories(tasksDir.resolve("suite"));
        TaskSuiteLoader suite = new TaskSuiteLoader(suiteDir.toString());

        assertNull(suite.load("task_id_x/../../task_id_out"));
        assertNull(suite.load("../task_id_out"));
        assertNull(suite.load(tasksDir.resolve("task_id_out").toString()));
        assertNull(suite.load((String) null));
    }

    @Test
    void testNestedTaskDirectoryIsRejected() throws Exception {
        Path nested = Files.createDirectories(tasksDir.resolve("task_id_1").resolve("task_id_inner"));
        Files.writeString(nested.resolve(TaskSuiteLoader.DESCRIPTION_FILE), "inner");
        Files.writeString(nested.resolve(TaskSuiteLoader.TEMPLATE_FILE), "def i := {{code}}");

        assertNull(loader.load("task_id_1/task_id_inner"));
        assertNull(loader.load("scratch"));
        assertNotNull(loader.load("task_id_1/../task_id_0"));
    }

    @Test
    void testLoadAllSkipsIncompleteTasks() {
        List<BenchmarkTask> tasks = loader.loadAll();

        assertEquals(2, tasks.size());
        assertEquals("task_id_0", tasks.get(0).getTaskId());
    }

    @Test
    void testMissingTasksDirectoryDiscoversNothing() {
        assertTrue(new TaskSuiteLoader(tasksDir.resolve("absent").toString()).discover().isEmpty());
    }

    @Test
    void testRunnerSolvesAndEvaluatesEveryLoadedTask() {
        ProofOrchestrator orchestrator = mock(ProofOrchestrator.class);
        SolutionEvaluator evaluator = mock(SolutionEvaluator.class);
        ProofSolution solution = new ProofSolution("a", "omega");
        when(orchestrator.solve(anyString(), anyString())).thenReturn(solution);
        when(evaluator.evaluate(any(), eq(solution)))
                .thenAnswer(inv -> TaskEvaluation.compiled(
                        ((BenchmarkTask) inv.getArgument(0)).getTaskId(), true, "", "", solution));

        BenchmarkRunner runner = new BenchmarkRunner(orchestrator, loader, evaluator);
        List<TaskEvaluation> evaluations = runner.runAll();

        assertEquals(2, evaluations.size());
        verify(orchestrator).solve("Add two numbers", "def add := {{code}} -- {{proof}}");
        assertNull(runner.runTask("task_id_99"));
        assertTrue(runner.runTask("task_id_0").isSuccess());
    }
}
