package io.macroq.task;

import io.macroq.error.ErrorKind;
import io.macroq.error.SchedulerException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

final class TaskCodecTest {
    private final TaskCodec codec = new TaskCodec(TaskTypeRegistry.withBuiltins());

    @Test
    void restoresPayloadStatusPriorityAndParameters() {
        ScaleTask task = new ScaleTask(3.0);
        task.setInput(2.0);
        task.withPriority(0.5);
        task.setWaiting();

        TaskCodec.DecodedTask decoded = codec.decode(codec.encode(task, 7L, TaskCodec.Part.ALL));

        Assertions.assertEquals(7L, decoded.index());
        ScaleTask copy = (ScaleTask) decoded.task();
        Assertions.assertNotSame(task, copy);
        Assertions.assertEquals(2.0, copy.input());
        Assertions.assertEquals(3.0, copy.factor());
        Assertions.assertEquals(0.5, copy.priority());
        Assertions.assertEquals(TaskStatus.WAITING, copy.status());
        Assertions.assertNull(copy.result());
    }

    @Test
    void partSelectsWhatIsWritten() {
        ScaleTask task = new ScaleTask(2.0);
        task.setInput(4.0);
        task.setResult(8.0);

        ScaleTask inputOnly = (ScaleTask) codec.decode(codec.encode(task, 0L, TaskCodec.Part.INPUT)).task();
        ScaleTask resultOnly = (ScaleTask) codec.decode(codec.encode(task, 0L, TaskCodec.Part.RESULT)).task();

        Assertions.assertEquals(4.0, inputOnly.input());
        Assertions.assertNull(inputOnly.result());
        Assertions.assertNull(resultOnly.input());
        Assertions.assertEquals(8.0, resultOnly.result());
    }

    @Test
    void stripedVectorSurvivesTheWire() {
        GroupSumTask task = new GroupSumTask();
        task.setInput(StripedVector.of(1.0, 2.0, 3.5));

        GroupSumTask copy = (GroupSumTask) codec.decode(codec.encode(task)).task();

        Assertions.assertEquals(StripedVector.of(1.0, 2.0, 3.5), copy.input());
    }

    @Test
    void envelopeCarriesTypeTagAndSchema() {
        EchoTask task = new EchoTask();
        task.setInput("hi");

        TaskEnvelope envelope = codec.readEnvelope(codec.encode(task, 3L, TaskCodec.Part.INPUT));

        Assertions.assertEquals(TaskCodec.SCHEMA, envelope.schema());
        Assertions.assertEquals(EchoTask.TYPE, envelope.type());
        Assertions.assertEquals(3L, envelope.index());
        Assertions.assertEquals("hi", envelope.input().asText());
        Assertions.assertNull(envelope.result());
    }

    @Test
    void unknownTypeTagIsSerializationFailure() {
        byte[] raw = """
                {"schema":"macroq.task.v1","type":"no-such-task","index":0,"status":"WAITING","priority":0}"""
                .getBytes(StandardCharsets.UTF_8);

        SchedulerException error = Assertions.assertThrows(SchedulerException.class, () -> codec.decode(raw));
        Assertions.assertEquals(ErrorKind.SERIALIZATION, error.kind());
        Assertions.assertTrue(error.getMessage().contains("no-such-task"));
    }

    @Test
    void rejectsMalformedRecords() {
        byte[] wrongSchema = "{\"schema\":\"other\",\"type\":\"scale\"}".getBytes(StandardCharsets.UTF_8);
        byte[] notJson = "not json".getBytes(StandardCharsets.UTF_8);

        Assertions.assertEquals(ErrorKind.SERIALIZATION,
                Assertions.assertThrows(SchedulerException.class, () -> codec.decode(new byte[0])).kind());
        Assertions.assertEquals(ErrorKind.SERIALIZATION,
                Assertions.assertThrows(SchedulerException.class, () -> codec.decode(wrongSchema)).kind());
        Assertions.assertEquals(ErrorKind.SERIALIZATION,
                Assertions.assertThrows(SchedulerException.class, () -> codec.decode(notJson)).kind());
    }

    @Test
    void registryRejectsConflictingTag() {
        TaskTypeRegistry registry = TaskTypeRegistry.withBuiltins();
        registry.register(new ScaleTask(9.0));

        SchedulerException error = Assertions.assertThrows(
                SchedulerException.class,
                () -> registry.register(ScaleTask.TYPE, EchoTask.class, EchoTask::new)
        );
        Assertions.assertEquals(ErrorKind.CONFIGURATION, error.kind());
        Assertions.assertTrue(registry.types().contains(GroupSumTask.TYPE));
    }
}
