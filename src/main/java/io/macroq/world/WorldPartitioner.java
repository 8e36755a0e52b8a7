package io.macroq.world;

import io.macroq.error.SchedulerException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class WorldPartitioner {
    private WorldPartitioner() {
    }

    public static List<List<Integer>> processLists(int processes, int nworld) {
        validate(processes, nworld);
        List<List<Integer>> lists = new ArrayList<>(nworld);
        for (int i = 0; i < nworld; i++) {
            lists.add(new ArrayList<>());
        }
        for (int rank = 0; rank < processes; rank++) {
            lists.get(rank % nworld).add(rank);
        }
        List<List<Integer>> out = new ArrayList<>(nworld);
        for (List<Integer> list : lists) {
            out.add(Collections.unmodifiableList(list));
        }
        return Collections.unmodifiableList(out);
    }

    public static World createWorlds(World parent, int nworld) {
        List<List<Integer>> lists = processLists(parent.size(), nworld);
        int split = parent.nextSplit();
        int group = groupOf(parent.rank(), nworld);
        List<Integer> members = lists.get(group);
        List<Integer> parentRanks = parent.universeRanks();
        int[] universeRanks = new int[members.size()];
        for (int i = 0; i < members.size(); i++) {
            universeRanks[i] = parentRanks.get(members.get(i));
        }
        World sub = parent.subWorld(parent.id() + "/split-" + split + "/world-" + group, universeRanks);
        parent.fence();
        return sub;
    }

    static int groupOf(int rank, int nworld) {
        return rank % nworld;
    }

    private static void validate(int processes, int nworld) {
        if (nworld < 1) {
            throw SchedulerException.configuration("number of worlds must be positive, got " + nworld);
        }
        if (processes < nworld) {
            throw SchedulerException.configuration(
                    "trying to create " + nworld + " worlds with " + processes + " processes; increase number of processes");
        }
    }
}
