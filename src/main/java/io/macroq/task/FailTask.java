package io.macroq.task;

import io.macroq.world.World;

public final class FailTask extends MacroTask<String, String> {
    public static final String TYPE = "fail";

    public FailTask() {
        super(String.class, String.class);
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public MacroTask<String, String> create() {
        return new FailTask();
    }

    @Override
    public void run(World world) {
        throw new IllegalStateException("intentional failure from fail task: " + input());
    }
}
