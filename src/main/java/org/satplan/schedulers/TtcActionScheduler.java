package org.satplan.schedulers;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.satplan.data.ActionType;
import org.satplan.data.Antenna;
import org.satplan.data.AntennaWindow;
import org.satplan.data.DownlinkAction;
import org.satplan.data.ScheduleResult;
import org.satplan.data.ScheduleSlot;
import org.satplan.data.SchedulerConfig;
import org.satplan.data.TtcStation;
import org.satplan.data.UplinkAction;
import org.satplan.data.UplinkRequest;
import org.satplan.utils.TimeUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Places uplink and downlink actions on antenna time slots.
 * <p>
 * Candidate windows are tried in the given order and the first feasible one wins. The conflict check and
 * the slot append happen under the antenna lock, so concurrent callers never both see a slot as free.
 * Failures are returned as {@link ScheduleResult#failure(String)} and allocate nothing.
 */
@Slf4j
public class TtcActionScheduler {
    protected static final double MEGABITS_PER_GIGABYTE = 8 * 1024;

    private final Map<String, TtcStation> stations = new LinkedHashMap<>();
    @Getter
    protected final SchedulerConfig config;
    private final AtomicInteger actionCounter = new AtomicInteger();
    private final List<UplinkAction> scheduledUplinks = new CopyOnWriteArrayList<>();
    private final List<DownlinkAction> scheduledDownlinks = new CopyOnWriteArrayList<>();

    public TtcActionScheduler(List<TtcStation> stations, SchedulerConfig config) {
        config.validate();
        stations.forEach(station -> this.stations.put(station.getId(), station));
        this.config = config;
    }

    public static double transferDurationSec(double dataVolumeGb, double rateMbps) {
        return dataVolumeGb * MEGABITS_PER_GIGABYTE / rateMbps;
    }

    public static double transferCapacityGb(double durationSec, double rateMbps) {
        return rateMbps * durationSec / MEGABITS_PER_GIGABYTE;
    }

    public ScheduleResult<UplinkAction> scheduleUplink(UplinkRequest request, List<AntennaWindow> windows) {
        for (final var window : windows) {
            final var station = stations.get(window.getStationId());
            final var antenna = findAntenna(window.getStationId(), window.getAntennaId());
            if (station == null || antenna.isEmpty()) {
                log.debug("Skipping uplink window on unknown antenna " + window.getStationId() + "/" + window.getAntennaId());
                continue;
            }

            final var duration = station.calculateUplinkDuration(request.getTaskCount());
            final var start = request.getEarliestTime() == null
                    ? window.getStartTime()
                    : TimeUtils.max(window.getStartTime(), request.getEarliestTime());
            final var end = TimeUtils.plusSeconds(start, duration);
            if (request.getLatestTime() != null && end.isAfter(request.getLatestTime())) {
                log.debug("Uplink window at " + window.getAntennaId() + " ends after the deadline");
                continue;
            }
            if (end.isAfter(window.getEndTime())) {
                log.debug("Uplink of " + duration + "s does not fit the window at " + window.getAntennaId());
                continue;
            }

            final var reservation = reserve(antenna.get(), start, end, "UL", ActionType.UPLINK, request.getSatelliteId());
            if (!reservation.isSuccess()) {
                log.debug("Uplink candidate at " + window.getAntennaId() + " rejected: " + reservation.getMessage());
                continue;
            }
            final var actionId = reservation.orElseThrow();

            final var action = new UplinkAction(actionId, request.getSatelliteId(), station.getId(), antenna.get().getId(),
                    start, end, duration, List.copyOf(request.getTaskIds()));
            scheduledUplinks.add(action);
            log.info("Uplink " + actionId + " for " + request.getSatelliteId() + " scheduled at "
                    + station.getId() + "/" + antenna.get().getId() + " from " + TimeUtils.format(start));
            return ScheduleResult.success(action, "Scheduled to " + station.getName() + " " + antenna.get().getName());
        }
        log.warn("No usable uplink window for " + request.getSatelliteId() + " tasks " + request.getTaskIds());
        return ScheduleResult.failure("No usable uplink window");
    }

    public ScheduleResult<DownlinkAction> scheduleDownlink(String satelliteId, double dataVolumeGb, List<AntennaWindow> windows) {
        return scheduleDownlink(satelliteId, dataVolumeGb, windows, null);
    }

    public ScheduleResult<DownlinkAction> scheduleDownlink(String satelliteId,
                                                           double dataVolumeGb,
                                                           List<AntennaWindow> windows,
                                                           Instant earliestTime) {
        for (final var window : windows) {
            final var station = stations.get(window.getStationId());
            final var antenna = findAntenna(window.getStationId(), window.getAntennaId());
            if (station == null || antenna.isEmpty()) {
                log.debug("Skipping downlink window on unknown antenna " + window.getStationId() + "/" + window.getAntennaId());
                continue;
            }

            final var rate = Math.min(window.getMaxDataRateMbps(), antenna.get().getMaxDataRateMbps());
            if (rate <= 0) continue;
            final var duration = transferDurationSec(dataVolumeGb, rate);
            final var start = earliestTime == null ? window.getStartTime() : TimeUtils.max(window.getStartTime(), earliestTime);
            final var end = TimeUtils.plusSeconds(start, duration);
            if (end.isAfter(window.getEndTime())) {
                log.debug("Downlink of " + dataVolumeGb + "GB does not fit the window at " + window.getAntennaId());
                continue;
            }

            final var reservation = reserve(antenna.get(), start, end, "DL", ActionType.DOWNLINK, satelliteId);
            if (!reservation.isSuccess()) {
                log.debug("Downlink candidate at " + window.getAntennaId() + " rejected: " + reservation.getMessage());
                continue;
            }
            final var actionId = reservation.orElseThrow();

            final var action = DownlinkAction.builder()
                    .id(actionId)
                    .satelliteId(satelliteId)
                    .stationId(station.getId())
                    .antennaId(antenna.get().getId())
                    .startTime(start)
                    .endTime(end)
                    .durationSec(duration)
                    .dataVolumeGb(dataVolumeGb)
                    .dataRateMbps(rate)
                    .build();
            registerDownlink(action);
            log.info("Downlink " + actionId + " for " + satelliteId + " scheduled at "
                    + station.getId() + "/" + antenna.get().getId() + " from " + TimeUtils.format(start));
            return ScheduleResult.success(action, "Scheduled to " + station.getName() + " " + antenna.get().getName());
        }
        log.warn("No usable downlink window for " + satelliteId + " (" + dataVolumeGb + "GB)");
        return ScheduleResult.failure("No usable downlink window");
    }

    public double getAntennaUtilization(String antennaId) {
        final var antenna = findAntenna(antennaId);
        if (antenna.isEmpty()) return 0.0;
        final var slots = antenna.get().getSlots();
        if (slots.isEmpty()) return 0.0;

        var used = 0.0;
        var first = slots.get(0).getStartTime();
        var last = slots.get(0).getEndTime();
        for (final var slot : slots) {
            used += TimeUtils.secondsBetween(slot.getStartTime(), slot.getEndTime());
            first = TimeUtils.min(first, slot.getStartTime());
            last = TimeUtils.max(last, slot.getEndTime());
        }
        final var span = TimeUtils.secondsBetween(first, last);
        return span > 0 ? used / span : 0.0;
    }

    public List<UplinkAction> getScheduledUplinks() {
        return List.copyOf(scheduledUplinks);
    }

    public List<DownlinkAction> getScheduledDownlinks() {
        return List.copyOf(scheduledDownlinks);
    }

    public Collection<TtcStation> getStations() {
        return stations.values();
    }

    public Optional<TtcStation> getStation(String stationId) {
        return Optional.ofNullable(stations.get(stationId));
    }

    public List<Antenna> getAllAntennas() {
        final var result = new ArrayList<Antenna>();
        stations.values().forEach(station -> result.addAll(station.getAntennas()));
        return result;
    }

    public void clearSchedule() {
        stations.values().forEach(station -> station.getAntennas().forEach(Antenna::clearSlots));
        scheduledUplinks.clear();
        scheduledDownlinks.clear();
        actionCounter.set(0);
    }

    protected Optional<Antenna> findAntenna(String stationId, String antennaId) {
        final var station = stations.get(stationId);
        if (station == null) return Optional.empty();
        return station.getAntenna(antennaId);
    }

    protected Optional<Antenna> findAntenna(String antennaId) {
        return stations.values().stream()
                .flatMap(station -> station.getAntennas().stream())
                .filter(antenna -> antenna.getId().equals(antennaId))
                .findFirst();
    }

    protected String nextActionId(String prefix) {
        return String.format("%s_%04d", prefix, actionCounter.incrementAndGet());
    }

    protected void registerDownlink(DownlinkAction action) {
        scheduledDownlinks.add(action);
    }

    protected ScheduleResult<String> reserve(Antenna antenna, Instant start, Instant end, String idPrefix,
                                             ActionType actionType, String satelliteId) {
        antenna.getLock().lock();
        try {
            final var conflict = antenna.findConflict(start, end, satelliteId);
            if (conflict.isPresent()) return ScheduleResult.failure(conflict.get());
            final var actionId = nextActionId(idPrefix);
            antenna.addSlot(new ScheduleSlot(antenna.getId(), start, end, actionId, actionType, satelliteId));
            return ScheduleResult.success(actionId, "reserved");
        } finally {
            antenna.getLock().unlock();
        }
    }
}
