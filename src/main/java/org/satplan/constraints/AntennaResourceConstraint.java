package org.satplan.constraints;

import org.satplan.data.Antenna;
import org.satplan.data.ConstraintViolation;
import org.satplan.data.DownlinkAction;
import org.satplan.data.UplinkAction;
import org.satplan.data.ViolationSeverity;
import org.satplan.data.ViolationType;
import org.satplan.utils.TimeUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One satellite per antenna at a time, and the antenna switch time between actions serving different
 * satellites.
 */
public class AntennaResourceConstraint {

    public List<ConstraintViolation> checkAntennaSchedule(Antenna antenna, List<AntennaAction> actions) {
        final var result = new ArrayList<ConstraintViolation>();
        final var sorted = actions.stream().sorted(Comparator.comparing(AntennaAction::getStartTime)).toList();
        for (var i = 0; i < sorted.size(); i++) {
            final var current = sorted.get(i);
            for (var j = i + 1; j < sorted.size() && sorted.get(j).getStartTime().isBefore(current.getEndTime()); j++) {
                final var other = sorted.get(j);
                if (TimeUtils.overlaps(current.getStartTime(), current.getEndTime(), other.getStartTime(), other.getEndTime())) {
                    result.add(ConstraintViolation.builder()
                            .type(ViolationType.ANTENNA_CONFLICT)
                            .severity(ViolationSeverity.ERROR)
                            .message("Antenna " + antenna.getId() + " conflict: " + current.getId() + " overlaps " + other.getId())
                            .subjectId(antenna.getId())
                            .action1Id(current.getId())
                            .action2Id(other.getId())
                            .build());
                }
            }
        }

        // each action is compared with the latest-ending earlier action as well as its start-order predecessor
        AntennaAction latest = null;
        for (var i = 0; i < sorted.size(); i++) {
            final var current = sorted.get(i);
            if (latest != null) {
                checkSwitch(antenna, latest, current).ifPresent(result::add);
                final var previous = sorted.get(i - 1);
                if (previous != latest) checkSwitch(antenna, previous, current).ifPresent(result::add);
            }
            if (latest == null || current.getEndTime().isAfter(latest.getEndTime())) latest = current;
        }
        return result;
    }

    private static Optional<ConstraintViolation> checkSwitch(Antenna antenna, AntennaAction earlier, AntennaAction later) {
        if (earlier.getSatelliteId().equals(later.getSatelliteId())) return Optional.empty();
        if (TimeUtils.overlaps(earlier.getStartTime(), earlier.getEndTime(), later.getStartTime(), later.getEndTime())) return Optional.empty();
        final var gap = TimeUtils.secondsBetween(earlier.getEndTime(), later.getStartTime());
        final var minGap = antenna.getSatelliteSwitchTimeSec();
        if (gap >= minGap) return Optional.empty();
        return Optional.of(ConstraintViolation.builder()
                .type(ViolationType.ANTENNA_SWITCH_TIME)
                .severity(ViolationSeverity.ERROR)
                .message(String.format("Antenna %s satellite switch gap too short: %.1fs < %.1fs", antenna.getId(), gap, minGap))
                .subjectId(antenna.getId())
                .action1Id(earlier.getId())
                .action2Id(later.getId())
                .requiredGapSec(minGap)
                .actualGapSec(gap)
                .build());
    }

    public List<ConstraintViolation> checkAll(Map<String, List<AntennaAction>> actionsByAntenna, Map<String, Antenna> antennas) {
        final var result = new ArrayList<ConstraintViolation>();
        actionsByAntenna.forEach((antennaId, actions) -> {
            final var antenna = antennas.get(antennaId);
            if (antenna != null) result.addAll(checkAntennaSchedule(antenna, actions));
        });
        return result;
    }

    public static Map<String, List<AntennaAction>> groupActionsByAntenna(List<UplinkAction> uplinks, List<DownlinkAction> downlinks) {
        final var result = new LinkedHashMap<String, List<AntennaAction>>();
        for (final var uplink : uplinks) {
            result.computeIfAbsent(uplink.getAntennaId(), id -> new ArrayList<>()).add(AntennaAction.fromUplink(uplink));
        }
        for (final var downlink : downlinks) {
            for (final var action : AntennaAction.fromDownlink(downlink)) {
                result.computeIfAbsent(action.getAntennaId(), id -> new ArrayList<>()).add(action);
            }
        }
        return result;
    }
}
