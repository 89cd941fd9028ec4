package io.workqueue.executor;

import io.workqueue.support.FixedTaskContext;
import io.workqueue.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class ScriptExecutorTest {
    private static final Path SH = Path.of("/bin/sh");

    @BeforeAll
    static void requireShell() {
        Assumptions.assumeTrue(Files.isExecutable(SH), "needs /bin/sh");
    }

    @Test
    void jsonOutputBecomesResult() throws Exception {
        ScriptExecutor executor = script("cat >/dev/null; echo '{\"ok\":true,\"n\":3}'");

        ExecutionResult result = executor.execute(FixedTaskContext.of("script", Jsons.parse("{\"x\":1}")));

        Assertions.assertTrue(result.success(), result.error());
        Assertions.assertTrue(result.result().path("ok").asBoolean());
        Assertions.assertEquals(3, result.result().path("n").asInt());
    }

    @Test
    void parametersArriveOnStdin() throws Exception {
        ScriptExecutor executor = script("cat");

        ExecutionResult result = executor.execute(FixedTaskContext.of("script", Jsons.parse("{\"name\":\"stdin\"}")));

        Assertions.assertTrue(result.success(), result.error());
        Assertions.assertEquals("stdin", result.result().path("name").asText());
    }

    @Test
    void plainTextOutputIsKeptAsText() throws Exception {
        ExecutionResult result = script("echo done").execute(FixedTaskContext.of("script", null));

        Assertions.assertTrue(result.success());
        Assertions.assertTrue(result.result().isTextual());
        Assertions.assertEquals("done", result.result().asText());
    }

    @Test
    void exitCodeTwoIsFatalOthersRetry() throws Exception {
        ExecutionResult fatal = script("echo bad input; exit 2").execute(FixedTaskContext.of("script", null));
        Assertions.assertFalse(fatal.success());
        Assertions.assertFalse(fatal.retryable());
        Assertions.assertTrue(fatal.error().contains("exit=2"));
        Assertions.assertTrue(fatal.error().contains("bad input"));

        ExecutionResult retry = script("exit 1").execute(FixedTaskContext.of("script", null));
        Assertions.assertFalse(retry.success());
        Assertions.assertTrue(retry.retryable());
    }

    @Test
    void outputLargerThanAPipeBufferCompletes() throws Exception {
        ScriptExecutor executor = script("head -c 200000 /dev/zero | tr '\\0' 'a'");

        ExecutionResult result = executor.execute(FixedTaskContext.of("script", null));

        Assertions.assertTrue(result.success(), result.error());
        Assertions.assertTrue(result.result().isTextual());
        Assertions.assertEquals(200_000, result.result().asText().length());
    }

    @Test
    void timeoutIsRetryable() throws Exception {
        ScriptExecutor executor = new ScriptExecutor("script", List.of(SH.toString(), "-c", "sleep 5"), 200L);

        ExecutionResult result = executor.execute(FixedTaskContext.of("script", null));

        Assertions.assertFalse(result.success());
        Assertions.assertTrue(result.retryable());
        Assertions.assertTrue(result.error().startsWith("script timeout"));
    }

    @Test
    void missingBinaryIsFatal() throws Exception {
        ScriptExecutor executor = new ScriptExecutor("script", List.of("/nonexistent/workqueue-binary"), 1_000L);

        ExecutionResult result = executor.execute(FixedTaskContext.of("script", null));

        Assertions.assertFalse(result.retryable());
        Assertions.assertTrue(result.error().startsWith("script spawn failed"));
    }

    @Test
    void rejectsEmptyConfiguration() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new ScriptExecutor("x", List.of(), 1_000L));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new ScriptExecutor(" ", List.of("true"), 1_000L));
    }

    private static ScriptExecutor script(String body) {
        return new ScriptExecutor("script", List.of(SH.toString(), "-c", body), 10_000L);
    }
}
