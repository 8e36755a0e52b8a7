package io.macroq.runtime;

import io.macroq.scheduler.MacroTaskQueue;

@FunctionalInterface
public interface QueueProgram<R> {
    R run(MacroTaskQueue queue) throws Exception;
}
