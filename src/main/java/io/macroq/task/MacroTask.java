package io.macroq.task;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.macroq.error.SchedulerException;
import io.macroq.world.World;

public abstract class MacroTask<I, R> {
    private final Class<I> inputType;
    private final Class<R> resultType;
    private double priority;
    private TaskStatus status = TaskStatus.UNKNOWN;
    private I input;
    private R result;

    protected MacroTask(Class<I> inputType, Class<R> resultType) {
        this.inputType = inputType;
        this.resultType = resultType;
    }

    public abstract String type();

    public abstract MacroTask<I, R> create();

    public abstract void run(World world) throws Exception;

    protected JsonNode parameters() {
        return null;
    }

    protected void restoreParameters(JsonNode parameters) {
    }

    public final I input() {
        return input;
    }

    public final void setInput(I input) {
        this.input = input;
    }

    public final R result() {
        return result;
    }

    public final void setResult(R result) {
        this.result = result;
    }

    public final double priority() {
        return priority;
    }

    public final MacroTask<I, R> withPriority(double priority) {
        this.priority = priority;
        return this;
    }

    public final MacroTask<I, R> withInput(I input) {
        MacroTask<I, R> task = create();
        task.setInput(input);
        task.priority = priority;
        return task;
    }

    public final TaskStatus status() {
        return status;
    }

    public final void setWaiting() {
        transition(TaskStatus.WAITING, TaskStatus.UNKNOWN);
    }

    public final void setRunning() {
        transition(TaskStatus.RUNNING, TaskStatus.WAITING);
    }

    public final void setComplete() {
        transition(TaskStatus.COMPLETE, TaskStatus.RUNNING);
    }

    public final void clearInput() {
        input = null;
    }

    public final void clearResult() {
        result = null;
    }

    public String describe() {
        return "task " + type() + " status=" + status + " priority=" + priority + " input=" + input;
    }

    @Override
    public String toString() {
        return describe();
    }

    public final void adoptResultOf(MacroTask<?, ?> finished) {
        if (finished.getClass() != getClass() || !type().equals(finished.type())) {
            throw SchedulerException.serialization(
                    "result of type " + finished.type() + " cannot be adopted by task type " + type());
        }
        if (finished.status() != TaskStatus.COMPLETE) {
            throw SchedulerException.serialization(
                    "result record of task type " + type() + " has status " + finished.status());
        }
        if (status != TaskStatus.COMPLETE) {
            throw SchedulerException.invariant(
                    "task " + type() + " is " + status + ", results are adopted only by complete tasks");
        }
        Object value = finished.result();
        if (value != null && !resultType.isInstance(value)) {
            throw SchedulerException.serialization(
                    "result " + value.getClass().getName() + " is not a " + resultType.getName());
        }
        this.result = resultType.cast(value);
    }

    final void restore(JsonNode inputNode, JsonNode resultNode, JsonNode parameterNode,
                       TaskStatus restoredStatus, double restoredPriority, ObjectMapper mapper) {
        try {
            this.input = isAbsent(inputNode) ? null : mapper.treeToValue(inputNode, inputType);
            this.result = isAbsent(resultNode) ? null : mapper.treeToValue(resultNode, resultType);
        } catch (JsonProcessingException e) {
            throw SchedulerException.serialization("Failed to restore state of task type " + type(), e);
        }
        if (!isAbsent(parameterNode)) {
            restoreParameters(parameterNode);
        }
        this.status = restoredStatus;
        this.priority = restoredPriority;
    }

    private void transition(TaskStatus next, TaskStatus required) {
        if (status == next) {
            return;
        }
        if (status != required) {
            throw SchedulerException.invariant(
                    "task " + type() + " cannot move from " + status + " to " + next);
        }
        status = next;
    }

    private static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }
}
