package org.satplan.schedulers;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.satplan.data.ActionType;
import org.satplan.data.Antenna;
import org.satplan.data.AntennaWindow;
import org.satplan.data.DownlinkAction;
import org.satplan.data.DownlinkPlan;
import org.satplan.data.DownlinkSegment;
import org.satplan.data.Satellite;
import org.satplan.data.SatelliteType;
import org.satplan.data.ScheduleResult;
import org.satplan.data.ScheduleSlot;
import org.satplan.data.SchedulerConfig;
import org.satplan.data.TtcStation;
import org.satplan.utils.TimeUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

import static org.satplan.data.DownlinkPlan.VOLUME_TOLERANCE_GB;

/**
 * Downlink strategies beyond a single antenna: several antennas of one station at once (aggregation),
 * one volume split over consecutive windows (segmentation), or both.
 * <p>
 * Every strategy plans completely against the current slot lists and then commits. The commit takes the
 * locks of all involved antennas, checks every planned slot again and only then appends them, so a
 * failed call never leaves slots behind.
 */
@Slf4j
public class AdvancedDownlinkScheduler extends TtcActionScheduler {
    private final AtomicInteger planCounter = new AtomicInteger();

    public AdvancedDownlinkScheduler(List<TtcStation> stations, SchedulerConfig config) {
        super(stations, config);
    }

    public ScheduleResult<DownlinkAction> scheduleAggregatedDownlink(Satellite satellite,
                                                                     double dataVolumeGb,
                                                                     String stationId,
                                                                     Instant windowStart,
                                                                     Instant windowEnd) {
        if (!canAggregate(satellite)) {
            return ScheduleResult.failure("Satellite " + satellite.getId() + " does not support multi-antenna aggregation");
        }
        final var station = getStation(stationId);
        if (station.isEmpty()) return ScheduleResult.failure("Unknown station " + stationId);

        final var planned = planAggregation(satellite.getId(), dataVolumeGb, station.get(), windowStart, windowEnd, true);
        if (!planned.isSuccess()) {
            log.warn("Aggregated downlink for " + satellite.getId() + " at " + stationId + " failed: " + planned.getMessage());
            return ScheduleResult.failure(planned.getMessage());
        }
        final var aggregation = planned.orElseThrow();
        return AntennaLocks.withLocks(aggregation.getAntennas(), () -> commitAggregation(satellite.getId(), aggregation));
    }

    public ScheduleResult<DownlinkPlan> planSegmentedDownlink(Satellite satellite,
                                                              String taskId,
                                                              double dataVolumeGb,
                                                              List<AntennaWindow> windows) {
        if (!canSegment(satellite)) {
            return ScheduleResult.failure("Satellite " + satellite.getId() + " does not support segmented downlink");
        }
        final var planned = planSegments(satellite.getId(), dataVolumeGb, windows, segmentOverhead(satellite), window -> true);
        if (!planned.isSuccess()) {
            log.warn("Segmented downlink of " + taskId + " failed: " + planned.getMessage());
            return ScheduleResult.failure(planned.getMessage());
        }
        return commitPlan(satellite.getId(), taskId, dataVolumeGb, null, planned.orElseThrow());
    }

    public ScheduleResult<DownlinkPlan> planHybridDownlink(Satellite satellite,
                                                           String taskId,
                                                           double dataVolumeGb,
                                                           List<AntennaWindow> windows) {
        final var aggregationAllowed = config.isPreferAggregation() && canAggregate(satellite);
        final var sorted = sortedWindows(windows);

        if (aggregationAllowed) {
            for (final var window : earliestWindowPerStation(sorted)) {
                final var station = getStation(window.getStationId());
                if (station.isEmpty()) continue;
                final var planned = planAggregation(satellite.getId(), dataVolumeGb, station.get(),
                        window.getStartTime(), window.getEndTime(), true);
                if (planned.isSuccess()) {
                    final var result = commitPlan(satellite.getId(), taskId, dataVolumeGb, planned.orElseThrow(), List.of());
                    if (result.isSuccess()) return result;
                }
            }
        }

        if (!canSegment(satellite)) {
            final var single = scheduleDownlink(satellite.getId(), dataVolumeGb, sorted);
            if (single.isSuccess()) {
                final var plan = new DownlinkPlan(String.format("PLAN_%04d", planCounter.incrementAndGet()),
                        satellite.getId(), taskId, dataVolumeGb, List.of(single.orElseThrow()), false, false);
                return ScheduleResult.success(plan, single.getMessage());
            }
            log.warn("Hybrid downlink of " + taskId + " failed: no single window fits and segmentation not supported");
            return ScheduleResult.failure("No window can hold " + dataVolumeGb + "GB and satellite "
                    + satellite.getId() + " does not support segmented downlink");
        }

        final var overhead = segmentOverhead(satellite);
        if (aggregationAllowed) {
            final var partial = bestPartialAggregation(satellite.getId(), dataVolumeGb, sorted);
            if (partial.isPresent()) {
                final var aggregation = partial.get();
                final var remaining = dataVolumeGb - aggregation.getDataVolumeGb();
                final var segments = planSegments(satellite.getId(), remaining, sorted, overhead,
                        window -> !TimeUtils.overlaps(window.getStartTime(), window.getEndTime(),
                                aggregation.getStartTime(), aggregation.getEndTime()));
                if (segments.isSuccess()) {
                    final var result = commitPlan(satellite.getId(), taskId, dataVolumeGb, aggregation, segments.orElseThrow());
                    if (result.isSuccess()) return result;
                }
            }
        }

        final var segments = planSegments(satellite.getId(), dataVolumeGb, sorted, overhead, window -> true);
        if (!segments.isSuccess()) {
            log.warn("Hybrid downlink of " + taskId + " failed: " + segments.getMessage());
            return ScheduleResult.failure(segments.getMessage());
        }
        return commitPlan(satellite.getId(), taskId, dataVolumeGb, null, segments.orElseThrow());
    }

    @Override
    public void clearSchedule() {
        super.clearSchedule();
        planCounter.set(0);
    }

    private ScheduleResult<PlannedAggregation> planAggregation(String satelliteId,
                                                               double dataVolumeGb,
                                                               TtcStation station,
                                                               Instant windowStart,
                                                               Instant windowEnd,
                                                               boolean requireFullVolume) {
        final var windowDuration = TimeUtils.secondsBetween(windowStart, windowEnd);
        if (windowDuration <= 0) return ScheduleResult.failure("Empty window at station " + station.getId());

        final var available = station.getAntennas().stream()
                .filter(antenna -> antenna.findConflict(windowStart, windowEnd, satelliteId).isEmpty())
                .sorted(Comparator.comparingDouble(Antenna::getMaxDataRateMbps).reversed().thenComparing(Antenna::getId))
                .toList();
        if (available.isEmpty()) return ScheduleResult.failure("No available antenna at station " + station.getId());

        final var selected = new ArrayList<Antenna>();
        var rate = 0.0;
        for (final var antenna : available) {
            if (selected.size() >= config.getMaxAggregatedAntennas()) break;
            selected.add(antenna);
            rate += antenna.getMaxDataRateMbps();
            if (transferDurationSec(dataVolumeGb, rate) <= windowDuration) break;
        }

        var volume = dataVolumeGb;
        if (transferDurationSec(volume, rate) > windowDuration) {
            if (requireFullVolume) {
                return ScheduleResult.failure(String.format(
                        "Aggregated rate %.0fMbps of %d antennas cannot transfer %.3fGB within the window",
                        rate, selected.size(), dataVolumeGb));
            }
            volume = transferCapacityGb(windowDuration, rate);
        }
        if (volume <= VOLUME_TOLERANCE_GB) return ScheduleResult.failure("Window at " + station.getId() + " holds no data");

        final var duration = transferDurationSec(volume, rate);
        return ScheduleResult.success(new PlannedAggregation(station, List.copyOf(selected), windowStart,
                TimeUtils.plusSeconds(windowStart, duration), duration, volume, rate), "planned");
    }

    private Optional<PlannedAggregation> bestPartialAggregation(String satelliteId, double dataVolumeGb, List<AntennaWindow> windows) {
        PlannedAggregation best = null;
        final var seen = new ArrayList<String>();
        for (final var window : windows) {
            final var key = window.getStationId() + "|" + window.getStartTime() + "|" + window.getEndTime();
            if (seen.contains(key)) continue;
            seen.add(key);
            final var station = getStation(window.getStationId());
            if (station.isEmpty()) continue;
            final var planned = planAggregation(satelliteId, dataVolumeGb, station.get(),
                    window.getStartTime(), window.getEndTime(), false);
            if (planned.isSuccess() && (best == null || planned.orElseThrow().getDataVolumeGb() > best.getDataVolumeGb())) {
                best = planned.orElseThrow();
            }
        }
        return Optional.ofNullable(best);
    }

    private ScheduleResult<List<PlannedSegment>> planSegments(String satelliteId,
                                                              double dataVolumeGb,
                                                              List<AntennaWindow> windows,
                                                              double overheadSec,
                                                              Predicate<AntennaWindow> allowed) {
        if (dataVolumeGb <= VOLUME_TOLERANCE_GB) return ScheduleResult.failure("Nothing to transfer");

        final var result = new ArrayList<PlannedSegment>();
        var remaining = dataVolumeGb;
        var offset = 0.0;
        Instant previousEnd = null;
        for (final var window : sortedWindows(windows)) {
            if (remaining <= VOLUME_TOLERANCE_GB || result.size() >= config.getMaxSegments()) break;
            if (!allowed.test(window)) continue;
            final var antenna = findAntenna(window.getStationId(), window.getAntennaId());
            if (antenna.isEmpty()) continue;
            if (previousEnd != null && window.getStartTime().isBefore(TimeUtils.plusSeconds(previousEnd, overheadSec))) continue;

            final var rate = Math.min(window.getMaxDataRateMbps(), antenna.get().getMaxDataRateMbps());
            final var segmentOverhead = result.isEmpty() ? 0.0 : overheadSec;
            final var usable = window.getDurationSec() - segmentOverhead;
            if (rate <= 0 || usable <= 0) continue;

            final var volume = Math.min(remaining, transferCapacityGb(usable, rate));
            final var transfer = transferDurationSec(volume, rate);
            final var end = TimeUtils.plusSeconds(window.getStartTime(), transfer + segmentOverhead);
            final var conflict = antenna.get().findConflict(window.getStartTime(), end, satelliteId);
            if (conflict.isPresent()) {
                log.debug("Segment window at " + window.getAntennaId() + " rejected: " + conflict.get());
                continue;
            }

            result.add(new PlannedSegment(window, antenna.get(), window.getStartTime(), end, transfer, segmentOverhead,
                    volume, offset, rate));
            remaining -= volume;
            offset += volume;
            previousEnd = end;
        }

        if (remaining > VOLUME_TOLERANCE_GB) {
            return ScheduleResult.failure(String.format("Windows cannot hold the whole volume, %.2fGB remaining", remaining));
        }
        return ScheduleResult.success(result, result.size() + " segments");
    }

    private ScheduleResult<DownlinkPlan> commitPlan(String satelliteId,
                                                    String taskId,
                                                    double totalDataGb,
                                                    PlannedAggregation aggregation,
                                                    List<PlannedSegment> segments) {
        final var antennas = new ArrayList<Antenna>();
        if (aggregation != null) antennas.addAll(aggregation.getAntennas());
        segments.forEach(segment -> antennas.add(segment.getAntenna()));

        return AntennaLocks.withLocks(antennas, () -> commitPlanLocked(satelliteId, taskId, totalDataGb, aggregation, segments));
    }

    private ScheduleResult<DownlinkPlan> commitPlanLocked(String satelliteId,
                                                          String taskId,
                                                          double totalDataGb,
                                                          PlannedAggregation aggregation,
                                                          List<PlannedSegment> segments) {
        final var conflict = findPlanConflict(satelliteId, aggregation, segments);
        if (conflict.isPresent()) {
            log.warn("Downlink plan of " + taskId + " no longer fits: " + conflict.get());
            return ScheduleResult.failure(conflict.get());
        }

        final var actions = new ArrayList<DownlinkAction>();
        if (aggregation != null) actions.add(commitAggregation(satelliteId, aggregation).orElseThrow());
        var sequence = 0;
        for (final var planned : segments) {
            sequence++;
            actions.add(commitSegment(satelliteId, taskId, planned, sequence, segments.size()));
        }

        final var plan = new DownlinkPlan(
                String.format("PLAN_%04d", planCounter.incrementAndGet()),
                satelliteId,
                taskId,
                totalDataGb,
                List.copyOf(actions),
                !segments.isEmpty(),
                aggregation != null);
        final var overhead = segments.stream().mapToDouble(PlannedSegment::getOverheadSec).sum();
        log.info(String.format("Downlink plan %s for task %s: %d actions, %.3fGB, overhead %.1fs",
                plan.getPlanId(), taskId, plan.getActionCount(), plan.getCompletedDataGb(), overhead));
        return ScheduleResult.success(plan, String.format("%d actions, total overhead %.1fs", actions.size(), overhead));
    }

    private Optional<String> findPlanConflict(String satelliteId, PlannedAggregation aggregation, List<PlannedSegment> segments) {
        if (aggregation != null) {
            for (final var antenna : aggregation.getAntennas()) {
                final var conflict = antenna.findConflict(aggregation.getStartTime(), aggregation.getEndTime(), satelliteId);
                if (conflict.isPresent()) return conflict;
            }
        }
        for (final var segment : segments) {
            final var conflict = segment.getAntenna().findConflict(segment.getStartTime(), segment.getEndTime(), satelliteId);
            if (conflict.isPresent()) return conflict;
        }
        return Optional.empty();
    }

    private ScheduleResult<DownlinkAction> commitAggregation(String satelliteId, PlannedAggregation aggregation) {
        for (final var antenna : aggregation.getAntennas()) {
            final var conflict = antenna.findConflict(aggregation.getStartTime(), aggregation.getEndTime(), satelliteId);
            if (conflict.isPresent()) return ScheduleResult.failure(conflict.get());
        }

        final var actionId = nextActionId("ADL");
        final var builder = DownlinkAction.builder()
                .id(actionId)
                .satelliteId(satelliteId)
                .stationId(aggregation.getStation().getId())
                .startTime(aggregation.getStartTime())
                .endTime(aggregation.getEndTime())
                .durationSec(aggregation.getDurationSec())
                .dataVolumeGb(aggregation.getDataVolumeGb())
                .dataRateMbps(aggregation.getRateMbps())
                .aggregated(true);
        for (final var antenna : aggregation.getAntennas()) {
            antenna.addSlot(new ScheduleSlot(antenna.getId(), aggregation.getStartTime(), aggregation.getEndTime(),
                    actionId, ActionType.DOWNLINK, satelliteId));
            builder.antennaId(antenna.getId());
        }
        final var action = builder.build();
        registerDownlink(action);
        log.info(String.format("Aggregated downlink %s for %s at %s: %d antennas, %.0fMbps",
                actionId, satelliteId, aggregation.getStation().getId(), action.getAntennaCount(), action.getDataRateMbps()));
        return ScheduleResult.success(action, String.format("Using %d antennas at aggregated rate %.0fMbps",
                action.getAntennaCount(), action.getDataRateMbps()));
    }

    private DownlinkAction commitSegment(String satelliteId, String taskId, PlannedSegment planned, int sequence, int total) {
        final var actionId = nextActionId("SDL");
        final var segment = new DownlinkSegment(
                String.format("%s_SEG%02d", taskId, sequence),
                taskId,
                sequence,
                total,
                planned.getDataVolumeGb(),
                planned.getDataOffsetGb());
        planned.getAntenna().addSlot(new ScheduleSlot(planned.getAntenna().getId(), planned.getStartTime(),
                planned.getEndTime(), actionId, ActionType.DOWNLINK, satelliteId));
        final var action = DownlinkAction.builder()
                .id(actionId)
                .satelliteId(satelliteId)
                .stationId(planned.getWindow().getStationId())
                .antennaId(planned.getAntenna().getId())
                .startTime(planned.getStartTime())
                .endTime(planned.getEndTime())
                .durationSec(planned.getTransferSec() + planned.getOverheadSec())
                .dataVolumeGb(planned.getDataVolumeGb())
                .dataRateMbps(planned.getRateMbps())
                .segment(segment)
                .segmentOverheadSec(planned.getOverheadSec())
                .build();
        registerDownlink(action);
        return action;
    }

    private boolean canAggregate(Satellite satellite) {
        return satellite.getSatelliteType().map(SatelliteType::isMultiAntennaCapable).orElse(true);
    }

    private boolean canSegment(Satellite satellite) {
        return satellite.getSatelliteType().map(SatelliteType::isSegmentedDownlinkCapable).orElse(true);
    }

    private double segmentOverhead(Satellite satellite) {
        return satellite.getSatelliteType().map(SatelliteType::getSegmentOverheadSec).orElse(config.getSegmentOverheadSec());
    }

    private static List<AntennaWindow> sortedWindows(List<AntennaWindow> windows) {
        return windows.stream()
                .sorted(Comparator.comparing(AntennaWindow::getStartTime).thenComparing(AntennaWindow::getAntennaId))
                .toList();
    }

    private static List<AntennaWindow> earliestWindowPerStation(List<AntennaWindow> sortedWindows) {
        final var result = new LinkedHashMap<String, AntennaWindow>();
        sortedWindows.forEach(window -> result.putIfAbsent(window.getStationId(), window));
        return List.copyOf(result.values());
    }

    @Getter
    @RequiredArgsConstructor
    private static class PlannedAggregation {
        private final TtcStation station;
        private final List<Antenna> antennas;
        private final Instant startTime;
        private final Instant endTime;
        private final double durationSec;
        private final double dataVolumeGb;
        private final double rateMbps;
    }

    @Getter
    @RequiredArgsConstructor
    private static class PlannedSegment {
        private final AntennaWindow window;
        private final Antenna antenna;
        private final Instant startTime;
        private final Instant endTime;
        private final double transferSec;
        private final double overheadSec;
        private final double dataVolumeGb;
        private final double dataOffsetGb;
        private final double rateMbps;
    }
}
