package org.imbalance.resampling;

import weka.core.DistanceFunction;
import weka.core.Instance;
import weka.core.Instances;

import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Exhaustive k-nearest-neighbour lookup by row index, with a Weka distance function.
 * Ties are broken by row index so results do not depend on iteration order.
 * <p>
 * Each query keeps only the {@code k} best candidates in a bounded max-heap, so a
 * lookup over {@code n} candidates costs {@code n} distances and {@code O(n log k)} bookkeeping.
 */
final class NeighbourSearch {

    private static final Comparator<Neighbour> NEAREST_FIRST =
            Comparator.comparingDouble(Neighbour::distance).thenComparingInt(Neighbour::row);

    private final Instances data;
    private final DistanceFunction distance;

    NeighbourSearch(Instances data, DistanceFunction distance) {
        this.data = data;
        this.distance = distance;
    }

    /**
     * @return up to {@code k} rows among {@code candidates}, nearest first, never {@code row} itself
     */
    int[] nearest(int row, List<Integer> candidates, int k) {
        if (k <= 0) {
            return new int[0];
        }
        Instance target = data.instance(row);
        // head is the worst of the current best k
        PriorityQueue<Neighbour> best = new PriorityQueue<>(k + 1, NEAREST_FIRST.reversed());
        for (int candidate : candidates) {
            if (candidate == row) {
                continue;
            }
            Neighbour next = new Neighbour(candidate, distance.distance(target, data.instance(candidate)));
            if (best.size() < k) {
                best.add(next);
            } else if (NEAREST_FIRST.compare(next, best.peek()) < 0) {
                best.poll();
                best.add(next);
            }
        }
        return best.stream()
                .sorted(NEAREST_FIRST)
                .mapToInt(Neighbour::row)
                .toArray();
    }

    /**
     * Number of rows among {@code neighbours} whose class differs from the one of {@code row}.
     */
    int countForeign(int row, int[] neighbours) {
        double own = data.instance(row).classValue();
        int foreign = 0;
        for (int neighbour : neighbours) {
            if (data.instance(neighbour).classValue() != own) {
                foreign++;
            }
        }
        return foreign;
    }

    private record Neighbour(int row, double distance) {
    }
}
