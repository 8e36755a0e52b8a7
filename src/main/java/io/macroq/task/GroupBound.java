package io.macroq.task;

import io.macroq.world.World;

public interface GroupBound {
    void bindTo(World world);
}
