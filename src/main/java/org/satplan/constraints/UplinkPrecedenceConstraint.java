package org.satplan.constraints;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.satplan.data.ConstraintViolation;
import org.satplan.data.ImagingAction;
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

@Getter
@RequiredArgsConstructor
public class UplinkPrecedenceConstraint {
    private final double minGapAfterUplinkSec;

    public Optional<ConstraintViolation> checkTask(ImagingAction imaging, List<UplinkAction> uplinks) {
        final var relevant = uplinks.stream()
                .filter(uplink -> uplink.containsTask(imaging.getId()))
                .filter(uplink -> uplink.getSatelliteId().equals(imaging.getSatelliteId()))
                .toList();
        if (relevant.isEmpty()) {
            return Optional.of(missing(imaging, "Task " + imaging.getId() + " has no uplink"));
        }

        final var latest = relevant.stream()
                .filter(uplink -> uplink.getEndTime().isBefore(imaging.getStartTime()))
                .max(Comparator.comparing(UplinkAction::getEndTime));
        if (latest.isEmpty()) {
            return Optional.of(missing(imaging, "Uplink of task " + imaging.getId() + " does not finish before the task starts"));
        }

        final var gap = TimeUtils.secondsBetween(latest.get().getEndTime(), imaging.getStartTime());
        if (gap >= minGapAfterUplinkSec) return Optional.empty();
        return Optional.of(ConstraintViolation.builder()
                .type(ViolationType.INSUFFICIENT_GAP)
                .severity(ViolationSeverity.WARNING)
                .message(String.format("Gap after uplink too short: %.1fs < %.1fs", gap, minGapAfterUplinkSec))
                .subjectId(imaging.getId())
                .action1Id(latest.get().getId())
                .action2Id(imaging.getId())
                .requiredGapSec(minGapAfterUplinkSec)
                .actualGapSec(gap)
                .build());
    }

    public List<ConstraintViolation> checkAll(List<ImagingAction> imagings, List<UplinkAction> uplinks) {
        final var result = new ArrayList<ConstraintViolation>();
        imagings.forEach(imaging -> checkTask(imaging, uplinks).ifPresent(result::add));
        return result;
    }

    public static Map<String, List<ImagingAction>> groupBySatellite(List<ImagingAction> imagings) {
        final var result = new LinkedHashMap<String, List<ImagingAction>>();
        imagings.forEach(imaging -> result.computeIfAbsent(imaging.getSatelliteId(), id -> new ArrayList<>()).add(imaging));
        result.values().forEach(list -> list.sort(Comparator.comparing(ImagingAction::getStartTime)));
        return result;
    }

    private static ConstraintViolation missing(ImagingAction imaging, String message) {
        return ConstraintViolation.builder()
                .type(ViolationType.MISSING_UPLINK)
                .severity(ViolationSeverity.ERROR)
                .message(message)
                .subjectId(imaging.getId())
                .action2Id(imaging.getId())
                .build();
    }
}
