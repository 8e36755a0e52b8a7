package io.macroq.task;

import com.fasterxml.jackson.databind.JsonNode;
import io.macroq.util.Jsons;
import io.macroq.world.World;

public final class ScaleTask extends MacroTask<Double, Double> {
    public static final String TYPE = "scale";

    private double factor;

    public ScaleTask() {
        this(1.0);
    }

    public ScaleTask(double factor) {
        super(Double.class, Double.class);
        this.factor = factor;
    }

    public double factor() {
        return factor;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public MacroTask<Double, Double> create() {
        return new ScaleTask(factor);
    }

    @Override
    public void run(World world) {
        Double value = input();
        if (value == null) {
            throw new IllegalStateException("scale task has no input");
        }
        setResult(value * factor);
    }

    @Override
    protected JsonNode parameters() {
        return Jsons.compact().createObjectNode().put("factor", factor);
    }

    @Override
    protected void restoreParameters(JsonNode parameters) {
        this.factor = parameters.path("factor").asDouble(1.0);
    }
}
