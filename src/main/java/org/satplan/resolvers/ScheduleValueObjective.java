package org.satplan.resolvers;

import org.satplan.data.AwcsatConfig;
import org.satplan.data.ObservationTask;
import org.satplan.data.Satellite;
import org.satplan.data.SatelliteType;
import org.satplan.data.SchedulerConfig;
import org.satplan.optimizers.AwcsatSolution;
import org.satplan.optimizers.ObjectiveFunction;
import org.satplan.schedulers.TtcActionScheduler;
import org.satplan.utils.TimeUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class ScheduleValueObjective implements ObjectiveFunction {
    private final List<ObservationTask> tasks;
    private final Map<String, Satellite> satellites = new HashMap<>();
    private final SchedulerConfig schedulerConfig;
    private final double stripExtensionMax;
    private final double stripExtensionMin;

    public ScheduleValueObjective(List<ObservationTask> tasks,
                                  List<Satellite> satellites,
                                  SchedulerConfig schedulerConfig,
                                  AwcsatConfig awcsatConfig) {
        this.tasks = List.copyOf(tasks);
        satellites.forEach(satellite -> this.satellites.put(satellite.getId(), satellite));
        this.schedulerConfig = schedulerConfig;
        this.stripExtensionMax = awcsatConfig.getStripExtensionMax();
        this.stripExtensionMin = awcsatConfig.getStripExtensionMin();
    }

    @Override
    public double evaluate(AwcsatSolution solution) {
        final var decoded = decode(solution);
        var score = 0.0;
        for (final var task : decoded) {
            score += task.getTask().getValue() * (1 + schedulerConfig.getStripExtensionBonus() * task.getStripExtensionRate());
        }
        return score - schedulerConfig.getViolationPenalty() * findTransitionViolations(decoded).size();
    }

    @Override
    public List<String> describeViolations(AwcsatSolution solution) {
        return findTransitionViolations(decode(solution));
    }

    public List<DecodedTask> decode(AwcsatSolution solution) {
        final var result = new ArrayList<DecodedTask>();
        final var count = Math.min(tasks.size(), solution.getTaskCount());
        for (var i = 0; i < count; i++) {
            final var task = tasks.get(i);
            final var imagingIndex = solution.decodeImagingOpportunity(i, task.getImagingOpportunityCount());
            final var downlinkIndex = solution.decodeDownlinkOpportunity(i, task.getDownlinkOpportunityCount());
            if (imagingIndex < 1 || downlinkIndex < 1) continue;

            final var imagingWindow = task.getImagingOpportunity(imagingIndex);
            final var downlinkWindow = task.getDownlinkOpportunity(downlinkIndex);
            if (!downlinkWindow.getSatelliteId().equals(imagingWindow.getSatelliteId())) continue;

            final var rate = solution.decodeStripExtensionRate(i, stripExtensionMax, stripExtensionMin);
            final var imagingSec = Math.min(imagingWindow.getDurationSec(), task.getRequiredImagingSec() * (1 + rate));
            final var imagingEnd = TimeUtils.plusSeconds(imagingWindow.getStartTime(), imagingSec);
            final var volume = task.getDataVolumeGb() * (1 + rate);
            final var earliestDownlink = TimeUtils.plusSeconds(imagingEnd, imagingToDownlinkSec(imagingWindow.getSatelliteId()));

            final var downlinkStart = TimeUtils.max(downlinkWindow.getStartTime(), earliestDownlink);
            if (!downlinkStart.isBefore(downlinkWindow.getEndTime())) continue;
            final var capacity = TtcActionScheduler.transferCapacityGb(
                    TimeUtils.secondsBetween(downlinkStart, downlinkWindow.getEndTime()), downlinkWindow.getMaxDataRateMbps());
            if (capacity < volume) continue;

            result.add(new DecodedTask(task, imagingIndex, downlinkIndex, imagingWindow, downlinkWindow,
                    imagingWindow.getStartTime(), imagingEnd, rate, volume, earliestDownlink));
        }
        return result;
    }

    private List<String> findTransitionViolations(List<DecodedTask> decoded) {
        final var bySatellite = new HashMap<String, List<DecodedTask>>();
        decoded.forEach(task -> bySatellite.computeIfAbsent(task.getSatelliteId(), id -> new ArrayList<>()).add(task));

        final var result = new ArrayList<String>();
        bySatellite.forEach((satelliteId, list) -> {
            list.sort(Comparator.comparing(DecodedTask::getImagingStart));
            final var minGap = imagingSwitchSec(satelliteId);
            for (var i = 1; i < list.size(); i++) {
                final var previous = list.get(i - 1);
                final var current = list.get(i);
                final var gap = TimeUtils.secondsBetween(previous.getImagingEnd(), current.getImagingStart());
                if (gap < minGap) {
                    result.add(String.format("imaging_switch %s -> %s on %s: %.1fs < %.1fs",
                            previous.getTask().getId(), current.getTask().getId(), satelliteId, gap, minGap));
                }
            }
        });
        result.sort(Comparator.naturalOrder());
        return result;
    }

    private double imagingToDownlinkSec(String satelliteId) {
        final var satellite = satellites.get(satelliteId);
        if (satellite == null) return schedulerConfig.getImagingToDownlinkTimeSec();
        return satellite.getSatelliteType()
                .map(SatelliteType::getImagingToDownlinkTimeSec)
                .orElse(schedulerConfig.getImagingToDownlinkTimeSec());
    }

    private double imagingSwitchSec(String satelliteId) {
        final var satellite = satellites.get(satelliteId);
        if (satellite == null) return schedulerConfig.getImagingSwitchTimeSec();
        return satellite.getSatelliteType()
                .map(SatelliteType::getImagingSwitchTimeSec)
                .orElse(schedulerConfig.getImagingSwitchTimeSec());
    }
}
