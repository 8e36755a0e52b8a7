package io.macroq.world;

@FunctionalInterface
public interface ProcessBody<R> {
    R run(World universe) throws Exception;
}
