package de.anton.wespe.analyser.wespe_analyzer.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Sums the per-run maps of a batch into one combined map.
 * <p>
 * Maps with identical coordinates are added cell by cell. Otherwise the coordinates are united and every
 * map is placed onto the union grid; cells no map covers count as zero. Time rows that hold less than one
 * electron per energy bin on average are dropped afterwards.
 */
public final class BatchMerger {

    private static final Logger logger = LoggerFactory.getLogger(BatchMerger.class);

    private BatchMerger() {
        throw new IllegalStateException("Utility class");
    }

    /**
     * @param maps per-run maps with the same steps and ordinate, raw labelings active
     * @param name name of the combined map
     * @return the combined map; {@link DelayEnergyMap#isMergeSuccessful()} is false when nothing usable remained
     * @throws IllegalArgumentException if the list is empty or the maps were built with different steps
     */
    public static DelayEnergyMap merge(List<DelayEnergyMap> maps, String name) {
        if (maps == null || maps.isEmpty()) {
            throw new IllegalArgumentException("At least one map is required for a merge.");
        }
        DelayEnergyMap first = maps.get(0);
        for (DelayEnergyMap map : maps) {
            if (map.getEnergyStep() != first.getEnergyStep() || map.getTimeStep() != first.getTimeStep()
                    || map.getOrdinate() != first.getOrdinate()) {
                throw new IllegalArgumentException(String.format(
                        "Cannot merge %s (%s eV, %s %s) with %s (%s eV, %s %s): steps differ.",
                        map.getName(), map.getEnergyStep(), map.getTimeStep(), map.getOrdinate().getUnits(),
                        first.getName(), first.getEnergyStep(), first.getTimeStep(), first.getOrdinate().getUnits()));
            }
        }

        DelayEnergyMap total = sameCoordinates(maps) ? sumAligned(maps, name) : sumOnUnion(maps, name);
        if (total.isDegenerate()) {
            logger.warn("Merge of {} maps produced an empty map, coordinates could not be aligned.", maps.size());
            return DelayEnergyMap.empty(first.getOrdinate(), first.getEnergyStep(), first.getTimeStep(),
                    first.getMonoEnergy(), name);
        }

        total = dropEmptyRows(total);
        if (total.isDegenerate()) {
            logger.warn("All time rows of merged map '{}' were below one electron per energy bin.", name);
            return total.withMergeSuccessful(false);
        }
        total = total.withReindexedRows();

        double[] binding = total.getEnergyCoordinates(EnergyAxis.BINDING);
        if (binding.length > 1 && ArrayStatistics.median(ArrayStatistics.gradient(binding)) > 0) {
            logger.debug("Binding energy increases along the energy axis, reversing it.");
            total = total.reversedEnergy();
        }
        logger.info("Merged {} maps into '{}': {} time rows x {} energy bins.",
                maps.size(), name, total.getTimeSize(), total.getEnergySize());
        return total;
    }

    private static boolean sameCoordinates(List<DelayEnergyMap> maps) {
        DelayEnergyMap first = maps.get(0);
        double[] energy = first.getEnergyCoordinates(EnergyAxis.KINETIC);
        double[] time = first.getTimeCoordinates(first.getOrdinate().getRawAxis());
        for (DelayEnergyMap map : maps) {
            if (!Arrays.equals(energy, map.getEnergyCoordinates(EnergyAxis.KINETIC))
                    || !Arrays.equals(time, map.getTimeCoordinates(map.getOrdinate().getRawAxis()))) {
                return false;
            }
        }
        return true;
    }

    private static DelayEnergyMap sumAligned(List<DelayEnergyMap> maps, String name) {
        DelayEnergyMap first = maps.get(0);
        double[][] sum = new double[first.getTimeSize()][first.getEnergySize()];
        for (DelayEnergyMap map : maps) {
            for (int i = 0; i < sum.length; i++) {
                for (int j = 0; j < sum[i].length; j++) {
                    double v = map.getValue(i, j);
                    if (!Double.isNaN(v)) sum[i][j] += v;
                }
            }
        }
        logger.debug("Maps share their coordinates, summed cell by cell.");
        return DelayEnergyMap.of(sum, first.getEnergyCoordinates(EnergyAxis.KINETIC),
                first.getTimeCoordinates(first.getOrdinate().getRawAxis()), first.getOrdinate(),
                first.getEnergyStep(), first.getTimeStep(), first.getMonoEnergy(), name);
    }

    private static DelayEnergyMap sumOnUnion(List<DelayEnergyMap> maps, String name) {
        TreeSet<Double> energySet = new TreeSet<>();
        TreeSet<Double> timeSet = new TreeSet<>();
        for (DelayEnergyMap map : maps) {
            for (double e : map.getEnergyCoordinates(EnergyAxis.KINETIC)) energySet.add(e);
            for (double t : map.getTimeCoordinates(map.getOrdinate().getRawAxis())) timeSet.add(t);
        }
        double[] energy = energySet.stream().mapToDouble(Double::doubleValue).toArray();
        double[] time = timeSet.stream().mapToDouble(Double::doubleValue).toArray();
        logger.info("Map coordinates differ, merging on the union grid ({} time rows x {} energy bins).",
                time.length, energy.length);

        double[][] sum = new double[time.length][energy.length];
        for (DelayEnergyMap map : maps) {
            double[] mapEnergy = map.getEnergyCoordinates(EnergyAxis.KINETIC);
            double[] mapTime = map.getTimeCoordinates(map.getOrdinate().getRawAxis());
            for (int i = 0; i < mapTime.length; i++) {
                int row = Arrays.binarySearch(time, mapTime[i]);
                for (int j = 0; j < mapEnergy.length; j++) {
                    double v = map.getValue(i, j);
                    if (!Double.isNaN(v)) sum[row][Arrays.binarySearch(energy, mapEnergy[j])] += v;
                }
            }
        }
        DelayEnergyMap first = maps.get(0);
        return DelayEnergyMap.of(sum, energy, time, first.getOrdinate(), first.getEnergyStep(),
                first.getTimeStep(), first.getMonoEnergy(), name);
    }

    private static DelayEnergyMap dropEmptyRows(DelayEnergyMap map) {
        int energyBins = map.getEnergySize();
        List<Integer> kept = new ArrayList<>();
        for (int i = 0; i < map.getTimeSize(); i++) {
            if (ArrayStatistics.nanSum(map.getRow(i)) / energyBins >= 1.0) {
                kept.add(i);
            }
        }
        int dropped = map.getTimeSize() - kept.size();
        if (dropped > 0) {
            double[] time = map.getTimeCoordinates();
            logger.debug("Dropping {} empty time rows: {}", dropped, Arrays.stream(map.allRows())
                    .filter(i -> !kept.contains(i)).mapToObj(i -> String.valueOf(time[i])).collect(Collectors.joining(", ")));
        }
        return map.subset(kept.stream().mapToInt(Integer::intValue).toArray(), map.allColumns());
    }
}
