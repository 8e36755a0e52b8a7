package io.macroq.world;

import io.macroq.error.WorldAbortedException;

import java.util.Arrays;
import java.util.concurrent.BrokenBarrierException;
import java.util.concurrent.CyclicBarrier;

// Barrier plus one exchange slot per member. Slots are written before and read after a barrier.
final class GroupContext {
    private final String id;
    private final int[] universeRanks;
    private final CyclicBarrier barrier;
    private final Object[] exchange;

    GroupContext(String id, int[] universeRanks) {
        if (universeRanks.length == 0) {
            throw new IllegalArgumentException("group cannot be empty: " + id);
        }
        this.id = id;
        this.universeRanks = universeRanks.clone();
        this.barrier = new CyclicBarrier(universeRanks.length);
        this.exchange = new Object[universeRanks.length];
    }

    String id() {
        return id;
    }

    int size() {
        return universeRanks.length;
    }

    int universeRank(int localRank) {
        return universeRanks[localRank];
    }

    int localRankOf(int universeRank) {
        for (int i = 0; i < universeRanks.length; i++) {
            if (universeRanks[i] == universeRank) {
                return i;
            }
        }
        return -1;
    }

    int[] universeRanks() {
        return universeRanks.clone();
    }

    void await(String operation) {
        try {
            barrier.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorldAbortedException("Interrupted in " + operation + " on " + id, e);
        } catch (BrokenBarrierException e) {
            throw new WorldAbortedException("Barrier broken in " + operation + " on " + id, e);
        }
    }

    void put(int localRank, Object value) {
        exchange[localRank] = value;
    }

    Object get(int localRank) {
        return exchange[localRank];
    }

    @Override
    public String toString() {
        return id + Arrays.toString(universeRanks);
    }
}
