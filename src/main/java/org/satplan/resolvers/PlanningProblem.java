package org.satplan.resolvers;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import org.satplan.data.AntennaWindow;
import org.satplan.data.GroundTarget;
import org.satplan.data.ObservationTask;
import org.satplan.data.Satellite;
import org.satplan.data.TtcStation;
import org.satplan.data.VisibilityWindow;
import org.satplan.visibility.VisibilityProvider;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Slf4j
@Getter
@ToString(onlyExplicitlyIncluded = true)
@RequiredArgsConstructor
@SuppressWarnings("ClassCanBeRecord")
public class PlanningProblem {
    private final List<Satellite> satellites;
    @ToString.Include
    private final List<ObservationTask> tasks;
    private final List<AntennaWindow> contactWindows;
    @ToString.Include
    private final Instant horizonStart;
    @ToString.Include
    private final Instant horizonEnd;

    public static PlanningProblem fromVisibility(VisibilityProvider provider,
                                                 List<Satellite> satellites,
                                                 List<GroundTarget> targets,
                                                 List<TtcStation> stations,
                                                 Instant horizonStart,
                                                 Instant horizonEnd,
                                                 TaskDefaults defaults) {
        final var contactWindows = new ArrayList<AntennaWindow>();
        for (final var satellite : satellites) {
            for (final var station : stations) {
                contactWindows.addAll(provider.computeGroundStationAccess(satellite, station, horizonStart, horizonEnd));
            }
        }
        contactWindows.sort(Comparator.comparing(AntennaWindow::getStartTime).thenComparing(AntennaWindow::getAntennaId));

        final var tasks = new ArrayList<ObservationTask>();
        for (final var target : targets) {
            final var imaging = new ArrayList<VisibilityWindow>();
            satellites.forEach(satellite -> imaging.addAll(provider.computeAccess(satellite, target, horizonStart, horizonEnd)));
            if (imaging.isEmpty()) {
                log.debug("Target " + target.getId() + " is not visible in the horizon, no task created");
                continue;
            }
            imaging.sort(Comparator.comparing(VisibilityWindow::getStartTime));
            final var imagingSatellites = imaging.stream().map(VisibilityWindow::getSatelliteId).distinct().toList();
            final var downlinks = contactWindows.stream()
                    .filter(window -> imagingSatellites.contains(window.getSatelliteId()))
                    .toList();
            tasks.add(new ObservationTask("T_" + target.getId(), target.getId(), defaults.getValue(),
                    defaults.getImagingSec(), defaults.getDataVolumeGb(), List.copyOf(imaging), downlinks));
        }
        log.info("Built " + tasks.size() + " tasks and " + contactWindows.size() + " contact windows");
        return new PlanningProblem(List.copyOf(satellites), List.copyOf(tasks), List.copyOf(contactWindows),
                horizonStart, horizonEnd);
    }

    @Getter
    @RequiredArgsConstructor
    @SuppressWarnings("ClassCanBeRecord")
    public static class TaskDefaults {
        private final double value;
        private final double imagingSec;
        private final double dataVolumeGb;
    }
}
