package io.macroq.world;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class World {
    private final Universe universe;
    private final GroupContext context;
    private final int rank;
    private int splitCount;

    World(Universe universe, GroupContext context, int rank) {
        this.universe = universe;
        this.context = context;
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public int size() {
        return context.size();
    }

    public String id() {
        return context.id();
    }

    public int universeRank() {
        return context.universeRank(rank);
    }

    public List<Integer> universeRanks() {
        List<Integer> out = new ArrayList<>(context.size());
        for (int r : context.universeRanks()) {
            out.add(r);
        }
        return Collections.unmodifiableList(out);
    }

    public boolean isUniverse() {
        return Universe.UNIVERSE_ID.equals(context.id());
    }

    public Universe universe() {
        return universe;
    }

    public void fence() {
        context.await("fence");
    }

    @SuppressWarnings("unchecked")
    public <T> T broadcast(T value, int root) {
        if (root < 0 || root >= size()) {
            throw new IllegalArgumentException("broadcast root out of range: " + root + " in " + id());
        }
        if (rank == root) {
            context.put(root, value);
        }
        context.await("broadcast");
        T out = (T) context.get(root);
        context.await("broadcast");
        return out;
    }

    @SuppressWarnings("unchecked")
    public <T> List<T> allGather(T value) {
        context.put(rank, value);
        context.await("allGather");
        List<T> out = new ArrayList<>(size());
        for (int i = 0; i < size(); i++) {
            out.add((T) context.get(i));
        }
        context.await("allGather");
        return Collections.unmodifiableList(out);
    }

    World subWorld(String id, int[] universeRanks) {
        GroupContext sub = universe.context(id, universeRanks);
        int local = sub.localRankOf(universeRank());
        if (local < 0) {
            throw new IllegalStateException("rank " + universeRank() + " is not a member of " + sub);
        }
        return new World(universe, sub, local);
    }

    int nextSplit() {
        return splitCount++;
    }

    @Override
    public String toString() {
        return "World{" + id() + ", rank=" + rank + "/" + size() + ", universeRank=" + universeRank() + "}";
    }
}
