package io.macroq.task;

import io.macroq.world.World;

import java.util.List;

public final class GroupSumTask extends MacroTask<StripedVector, Double> {
    public static final String TYPE = "group-sum";

    public GroupSumTask() {
        super(StripedVector.class, Double.class);
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public MacroTask<StripedVector, Double> create() {
        return new GroupSumTask();
    }

    @Override
    public void run(World world) {
        StripedVector vector = input();
        if (vector == null) {
            throw new IllegalStateException("group-sum task has no input");
        }
        List<Double> partials = world.allGather(vector.localSum());
        double total = 0.0;
        for (double partial : partials) {
            total += partial;
        }
        setResult(total);
    }
}
