package org.satplan;

import lombok.extern.slf4j.Slf4j;
import org.satplan.data.GroundTarget;
import org.satplan.data.Satellite;
import org.satplan.data.SatelliteTypes;
import org.satplan.exceptions.AccessReportParserException;
import org.satplan.loaders.AccessReportLoader;
import org.satplan.loaders.ConfigLoader;
import org.satplan.loaders.StationsLoader;
import org.satplan.resolvers.MissionPlanner;
import org.satplan.resolvers.PlanningProblem;
import org.satplan.utils.TimeUtils;

@Slf4j
public class Main {
    public static void main(String[] args) {
        final var settings = ConfigLoader.loadConfig();
        log.info("Config loaded.");

        final var stations = StationsLoader.loadStations(settings);
        final var reports = AccessReportLoader.load(settings);
        log.info("Input reports loaded.");

        final var satelliteType = SatelliteTypes.byId(settings.getDefaultSatelliteType());
        if (satelliteType.isEmpty()) {
            log.warn("Unknown satellite type " + settings.getDefaultSatelliteType() + ", using scheduler defaults.");
        }
        final var satellites = reports.getSatelliteNames().stream()
                .map(name -> new Satellite(name, name, satelliteType.orElse(null)))
                .toList();
        final var targets = reports.getTargetNames().stream()
                .map(name -> new GroundTarget(name, name, 0.0, 0.0))
                .toList();

        final var horizonStart = settings.getHorizonStart() != null
                ? settings.getHorizonStart()
                : reports.getEarliestStart().orElseThrow(() -> new AccessReportParserException("Access reports contain no records"));
        final var horizonEnd = settings.getHorizonEnd() != null
                ? settings.getHorizonEnd()
                : reports.getLatestStop().orElseThrow(() -> new AccessReportParserException("Access reports contain no records"));

        final var problem = PlanningProblem.fromVisibility(reports, satellites, targets, stations, horizonStart, horizonEnd,
                new PlanningProblem.TaskDefaults(settings.getTaskValue(), settings.getTaskImagingSec(), settings.getTaskDataVolumeGb()));
        log.info("Planning " + problem.getTasks().size() + " tasks from " + TimeUtils.format(horizonStart)
                + " to " + TimeUtils.format(horizonEnd));

        final var planner = new MissionPlanner(settings.getAwcsatConfig(), settings.getSchedulerConfig(), stations);
        final var plan = planner.plan(problem);

        log.info(String.format("Objective %.3f, %d tasks assigned, %d uplinks, %d downlink actions.",
                plan.getSolution().getObjectiveValue(), plan.getSolution().getAssignments().size(),
                plan.getUplinkActions().size(), plan.getDownlinkActionCount()));
        plan.getSchedulingFailures().forEach((taskId, reason) -> log.warn("Task " + taskId + " not fully scheduled: " + reason));
        plan.getValidationReport().describe().forEach(log::info);
        stations.forEach(station -> station.getAntennas().forEach(antenna -> log.info(String.format("Antenna %s utilization %.2f",
                antenna.getId(), planner.getScheduler().getAntennaUtilization(antenna.getId())))));
        log.info("Mission planning complete.");
    }
}
