package io.steadyloop.worker;

import com.fasterxml.jackson.databind.JsonNode;
import io.steadyloop.error.FatalTaskException;
import io.steadyloop.error.TransientTaskException;
import io.steadyloop.model.TaskCategory;
import io.steadyloop.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

final class TaskHandlerTest {

    @Test
    void echoWrapsPayloadAndReportsCompletion() throws Exception {
        List<Double> reported = new ArrayList<>();
        TaskContext ctx = new TaskContext("t-1", "echo it", TaskCategory.DEFAULT, "{\"n\":1}", null, 2,
                (progress, checkpoint) -> reported.add(progress));

        JsonNode receipt = Jsons.mapper().readTree(new EchoTaskHandler().execute(ctx));

        Assertions.assertEquals("echo", receipt.path("handler").asText());
        Assertions.assertEquals("t-1", receipt.path("taskId").asText());
        Assertions.assertEquals("default", receipt.path("category").asText());
        Assertions.assertEquals(2, receipt.path("attempt").asInt());
        Assertions.assertEquals("{\"n\":1}", receipt.path("received").asText());
        Assertions.assertEquals(List.of(1.0d), reported);
    }

    @Test
    void scriptResultIsTrimmedStdout() throws Exception {
        ScriptTaskHandler handler = new ScriptTaskHandler(TaskCategory.RESOURCE,
                List.of("sh", "-c", "cat; echo \" $STEADYLOOP_TASK_ID\""), 5_000L);
        TaskContext ctx = new TaskContext("job-7", "copy", TaskCategory.RESOURCE, "hello", null, 1, null);

        Assertions.assertEquals("hello job-7", handler.execute(ctx));
        Assertions.assertEquals(TaskCategory.RESOURCE, handler.category());
        Assertions.assertEquals(3, handler.command().size());
    }

    @Test
    void scriptExitCodesMapToErrorKinds() {
        TaskContext ctx = new TaskContext("job-8", "run", TaskCategory.RESOURCE, null, null, 1, null);
        ScriptTaskHandler tempfail = new ScriptTaskHandler(TaskCategory.RESOURCE,
                List.of("sh", "-c", "echo busy; exit 75"), 5_000L);
        ScriptTaskHandler broken = new ScriptTaskHandler(TaskCategory.RESOURCE,
                List.of("sh", "-c", "echo nope; exit 3"), 5_000L);

        TransientTaskException retryable = Assertions.assertThrows(TransientTaskException.class,
                () -> tempfail.execute(ctx));
        Assertions.assertTrue(retryable.getMessage().contains("exit=75"));
        FatalTaskException fatal = Assertions.assertThrows(FatalTaskException.class, () -> broken.execute(ctx));
        Assertions.assertTrue(fatal.getMessage().contains("output=nope"));
    }

    @Test
    void registryKeepsOneHandlerPerCategory() {
        HandlerRegistry registry = new HandlerRegistry();
        registry.register(new EchoTaskHandler());
        EchoTaskHandler network = new EchoTaskHandler(TaskCategory.NETWORK);
        registry.register(new EchoTaskHandler(TaskCategory.NETWORK));
        registry.register(network);

        Assertions.assertSame(network, registry.find(TaskCategory.NETWORK).orElseThrow());
        Assertions.assertTrue(registry.find(TaskCategory.DATABASE).isEmpty());
        Assertions.assertEquals(2, registry.categories().size());
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new ScriptTaskHandler(TaskCategory.NETWORK, List.of(), 1_000L));
    }
}
