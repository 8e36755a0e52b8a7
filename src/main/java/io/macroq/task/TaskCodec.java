package io.macroq.task;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.macroq.error.SchedulerException;
import io.macroq.util.Jsons;

import java.io.IOException;

public final class TaskCodec {
    public static final String SCHEMA = "macroq.task.v1";

    private final TaskTypeRegistry registry;
    private final ObjectMapper mapper;

    public TaskCodec(TaskTypeRegistry registry) {
        this.registry = registry;
        this.mapper = Jsons.compact();
    }

    public enum Part {
        INPUT(true, false),
        RESULT(false, true),
        ALL(true, true);

        private final boolean input;
        private final boolean result;

        Part(boolean input, boolean result) {
            this.input = input;
            this.result = result;
        }

        public boolean includesInput() {
            return input;
        }

        public boolean includesResult() {
            return result;
        }
    }

    public TaskTypeRegistry registry() {
        return registry;
    }

    public byte[] encode(MacroTask<?, ?> task, long index, Part part) {
        try {
            JsonNode input = part.includesInput() && task.input() != null ? mapper.valueToTree(task.input()) : null;
            JsonNode result = part.includesResult() && task.result() != null ? mapper.valueToTree(task.result()) : null;
            TaskEnvelope envelope = new TaskEnvelope(
                    SCHEMA,
                    task.type(),
                    index,
                    task.status().name(),
                    task.priority(),
                    task.parameters(),
                    input,
                    result
            );
            return Jsons.toBytes(envelope);
        } catch (IOException | IllegalArgumentException e) {
            throw SchedulerException.serialization("Failed to encode task " + index + " of type " + task.type(), e);
        }
    }

    public byte[] encode(MacroTask<?, ?> task) {
        return encode(task, -1L, Part.ALL);
    }

    public DecodedTask decode(byte[] raw) {
        TaskEnvelope envelope = readEnvelope(raw);
        MacroTask<?, ?> task = registry.newInstance(envelope.type());
        TaskStatus status;
        try {
            status = TaskStatus.fromString(envelope.status());
        } catch (IllegalArgumentException e) {
            throw SchedulerException.serialization("Bad status in staged task " + envelope.index(), e);
        }
        task.restore(envelope.input(), envelope.result(), envelope.parameters(), status, envelope.priority(), mapper);
        return new DecodedTask(envelope.index(), task);
    }

    public TaskEnvelope readEnvelope(byte[] raw) {
        if (raw == null || raw.length == 0) {
            throw SchedulerException.serialization("staged task record is empty");
        }
        TaskEnvelope envelope;
        try {
            envelope = Jsons.fromBytes(raw, TaskEnvelope.class);
        } catch (IOException e) {
            throw SchedulerException.serialization("Failed to decode staged task record", e);
        }
        if (!SCHEMA.equals(envelope.schema())) {
            throw SchedulerException.serialization("unsupported task record schema: " + envelope.schema());
        }
        if (envelope.type() == null || envelope.type().isBlank()) {
            throw SchedulerException.serialization("staged task record has no type tag");
        }
        return envelope;
    }

    public record DecodedTask(long index, MacroTask<?, ?> task) {
    }
}
