package org.satplan.constraints;

import lombok.RequiredArgsConstructor;
import org.satplan.data.ConstraintViolation;
import org.satplan.data.DownlinkAction;
import org.satplan.data.ImagingAction;
import org.satplan.data.Satellite;
import org.satplan.data.SatelliteType;
import org.satplan.data.SchedulerConfig;
import org.satplan.data.ViolationSeverity;
import org.satplan.data.ViolationType;
import org.satplan.utils.TimeUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Minimum gaps between consecutive actions of one satellite. Times come from the satellite type, or
 * from the scheduler defaults when the satellite has none.
 */
@RequiredArgsConstructor
public class ActionTransitionConstraint {
    private final SchedulerConfig config;

    public List<ConstraintViolation> checkImagingSequence(List<ImagingAction> imagings, Satellite satellite) {
        final var result = new ArrayList<ConstraintViolation>();
        final var minGap = satellite.getSatelliteType()
                .map(SatelliteType::getImagingSwitchTimeSec)
                .orElse(config.getImagingSwitchTimeSec());
        final var sorted = imagings.stream().sorted(Comparator.comparing(ImagingAction::getStartTime)).toList();
        for (var i = 1; i < sorted.size(); i++) {
            final var previous = sorted.get(i - 1);
            final var current = sorted.get(i);
            final var gap = TimeUtils.secondsBetween(previous.getEndTime(), current.getStartTime());
            if (gap < minGap) {
                result.add(violation(ViolationType.IMAGING_SWITCH, satellite, previous.getId(), current.getId(), minGap, gap,
                        String.format("Imaging switch gap too short: %.1fs < %.1fs", gap, minGap)));
            }
        }
        return result;
    }

    public List<ConstraintViolation> checkDownlinkSequence(List<DownlinkAction> downlinks, Satellite satellite) {
        final var result = new ArrayList<ConstraintViolation>();
        final var minGap = satellite.getSatelliteType()
                .map(SatelliteType::getDownlinkSwitchTimeSec)
                .orElse(config.getDownlinkSwitchTimeSec());
        final var sorted = downlinks.stream().sorted(Comparator.comparing(DownlinkAction::getStartTime)).toList();
        for (var i = 1; i < sorted.size(); i++) {
            final var previous = sorted.get(i - 1);
            final var current = sorted.get(i);
            if (previous.getStationId().equals(current.getStationId())) continue;
            final var gap = TimeUtils.secondsBetween(previous.getEndTime(), current.getStartTime());
            if (gap < minGap) {
                result.add(violation(ViolationType.DOWNLINK_SWITCH, satellite, previous.getId(), current.getId(), minGap, gap,
                        String.format("Downlink station switch gap too short: %.1fs < %.1fs", gap, minGap)));
            }
        }
        return result;
    }

    public Optional<ConstraintViolation> checkImagingToDownlink(List<ImagingAction> imagings,
                                                                List<DownlinkAction> downlinks,
                                                                Satellite satellite) {
        final var lastImaging = imagings.stream().max(Comparator.comparing(ImagingAction::getStartTime));
        if (lastImaging.isEmpty()) return Optional.empty();
        final var firstDownlink = downlinks.stream()
                .filter(downlink -> !downlink.getStartTime().isBefore(lastImaging.get().getStartTime()))
                .min(Comparator.comparing(DownlinkAction::getStartTime));
        if (firstDownlink.isEmpty()) return Optional.empty();

        final var minGap = satellite.getSatelliteType()
                .map(SatelliteType::getImagingToDownlinkTimeSec)
                .orElse(config.getImagingToDownlinkTimeSec());
        final var gap = TimeUtils.secondsBetween(lastImaging.get().getEndTime(), firstDownlink.get().getStartTime());
        if (gap >= minGap) return Optional.empty();
        return Optional.of(violation(ViolationType.IMAGING_TO_DOWNLINK, satellite, lastImaging.get().getId(),
                firstDownlink.get().getId(), minGap, gap,
                String.format("Imaging to downlink gap too short: %.1fs < %.1fs", gap, minGap)));
    }

    public List<ConstraintViolation> checkAll(Satellite satellite, List<ImagingAction> imagings, List<DownlinkAction> downlinks) {
        final var result = new ArrayList<ConstraintViolation>();
        result.addAll(checkImagingSequence(imagings, satellite));
        result.addAll(checkDownlinkSequence(downlinks, satellite));
        checkImagingToDownlink(imagings, downlinks, satellite).ifPresent(result::add);
        return result;
    }

    private static ConstraintViolation violation(ViolationType type, Satellite satellite, String action1Id, String action2Id,
                                                 double requiredGap, double actualGap, String message) {
        return ConstraintViolation.builder()
                .type(type)
                .severity(ViolationSeverity.ERROR)
                .message(message)
                .subjectId(satellite.getId())
                .action1Id(action1Id)
                .action2Id(action2Id)
                .requiredGapSec(requiredGap)
                .actualGapSec(actualGap)
                .build();
    }
}
