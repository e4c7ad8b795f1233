package org.imbalance.resampling;

import lombok.Getter;
import org.imbalance.logging.Printer;
import weka.core.Instance;
import weka.core.Instances;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * SMOTE restricted to the minority rows that sit on the class border ("danger"
 * rows: at least half, but not all, of their neighbours belong to other classes).
 */
public class BorderlineSmoteResampler extends AbstractSmoteResampler {

    @Getter
    public enum Kind {
        BORDERLINE_1("BorderlineSMOTE-1"), // neighbours taken from the same class
        BORDERLINE_2("BorderlineSMOTE-2"); // neighbours from any class, half gap towards other classes

        private final String id;

        Kind(String id) {
            this.id = id;
        }
    }

    private final Kind kind;
    private final int dangerNeighbours;

    public BorderlineSmoteResampler(Kind kind, int neighbours, int dangerNeighbours, long seed) {
        super(kind.getId(), neighbours, seed);
        this.kind = kind;
        this.dangerNeighbours = dangerNeighbours;
    }

    @Override
    protected List<Instance> generate(Instances data, int classIndex, int amount, Random random) {
        NeighbourSearch search = new NeighbourSearch(data, distanceFunction(data));
        List<Integer> all = allRows(data);
        List<Integer> minority = rowsOfClass(data, classIndex);

        List<Integer> danger = dangerRows(search, minority, all);
        if (danger.isEmpty()) {
            Printer.printYellow(getName() + ": no border row in class '" + classLabel(data, classIndex)
                    + "', using every row of the class");
            danger = minority;
        }

        List<Integer> candidates = kind == Kind.BORDERLINE_1 ? minority : all;
        Map<Integer, int[]> neighbourCache = new HashMap<>();
        List<Instance> synthetic = new ArrayList<>(amount);
        for (int i = 0; i < amount; i++) {
            int row = danger.get(random.nextInt(danger.size()));
            int[] nn = neighbourCache.computeIfAbsent(row, r -> search.nearest(r, candidates, neighbours));
            Instance base = data.instance(row);
            Instance neighbour = data.instance(nn[random.nextInt(nn.length)]);

            double gap = random.nextDouble();
            if (neighbour.classValue() != base.classValue()) {
                gap *= 0.5;
            }
            synthetic.add(interpolate(data, base, neighbour, gap));
        }
        return synthetic;
    }

    private List<Integer> dangerRows(NeighbourSearch search, List<Integer> minority, List<Integer> all) {
        List<Integer> danger = new ArrayList<>();
        for (int row : minority) {
            int[] nn = search.nearest(row, all, dangerNeighbours);
            int foreign = search.countForeign(row, nn);
            if (foreign * 2 >= nn.length && foreign < nn.length) {
                danger.add(row);
            }
        }
        return danger;
    }
}
