package io.macroq.task;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.macroq.world.World;

import java.util.Arrays;

public final class StripedVector implements GroupBound {
    private final double[] values;
    private int stripe;
    private int stripes = 1;

    @JsonCreator
    public StripedVector(@JsonProperty("values") double[] values) {
        this.values = values == null ? new double[0] : values.clone();
    }

    public static StripedVector of(double... values) {
        return new StripedVector(values);
    }

    @JsonProperty("values")
    public double[] values() {
        return values.clone();
    }

    @Override
    public void bindTo(World world) {
        this.stripe = world.rank();
        this.stripes = world.size();
    }

    @JsonIgnore
    public int stripe() {
        return stripe;
    }

    @JsonIgnore
    public int stripes() {
        return stripes;
    }

    public double localSum() {
        double sum = 0.0;
        for (int i = stripe; i < values.length; i += stripes) {
            sum += values[i];
        }
        return sum;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StripedVector)) {
            return false;
        }
        return Arrays.equals(values, ((StripedVector) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return Arrays.toString(values);
    }
}
