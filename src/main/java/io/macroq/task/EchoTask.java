package io.macroq.task;

import io.macroq.util.Jsons;
import io.macroq.world.World;

public final class EchoTask extends MacroTask<String, String> {
    public static final String TYPE = "echo";

    public EchoTask() {
        super(String.class, String.class);
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public MacroTask<String, String> create() {
        return new EchoTask();
    }

    @Override
    public void run(World world) {
        String escapedInput = Jsons.toCompactJson(input());
        String output = """
                {"task":"echo","world":"%s","worldSize":%d,"received":%s}"""
                .formatted(world.id(), world.size(), escapedInput);
        setResult(output);
    }
}
