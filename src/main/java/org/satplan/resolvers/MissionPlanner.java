package org.satplan.resolvers;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.satplan.constraints.ConstraintChecker;
import org.satplan.constraints.UplinkPrecedenceConstraint;
import org.satplan.data.AntennaWindow;
import org.satplan.data.AwcsatConfig;
import org.satplan.data.DownlinkPlan;
import org.satplan.data.ImagingAction;
import org.satplan.data.Satellite;
import org.satplan.data.SchedulerConfig;
import org.satplan.data.TtcStation;
import org.satplan.data.UplinkAction;
import org.satplan.data.UplinkRequest;
import org.satplan.optimizers.AwcsatOptimizer;
import org.satplan.schedulers.AdvancedDownlinkScheduler;
import org.satplan.utils.TimeUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
public class MissionPlanner {
    private final AwcsatConfig awcsatConfig;
    private final SchedulerConfig schedulerConfig;
    @Getter
    private final AdvancedDownlinkScheduler scheduler;
    private final ConstraintChecker checker;

    public MissionPlanner(AwcsatConfig awcsatConfig, SchedulerConfig schedulerConfig, List<TtcStation> stations) {
        awcsatConfig.validate();
        this.awcsatConfig = awcsatConfig;
        this.schedulerConfig = schedulerConfig;
        this.scheduler = new AdvancedDownlinkScheduler(stations, schedulerConfig);
        this.checker = new ConstraintChecker(schedulerConfig, stations);
    }

    public MissionPlan plan(PlanningProblem problem) {
        final var objective = new ScheduleValueObjective(problem.getTasks(), problem.getSatellites(), schedulerConfig, awcsatConfig);
        final var optimizer = new AwcsatOptimizer(awcsatConfig, objective);
        final var solution = optimizer.solve(problem.getTasks(), problem.getSatellites());
        final var best = optimizer.getBestSolution();
        final var decoded = best == null ? List.<DecodedTask>of() : objective.decode(best);
        log.info("Optimizer selected " + decoded.size() + " of " + problem.getTasks().size() + " tasks");

        scheduler.clearSchedule();
        final var satellites = new HashMap<String, Satellite>();
        problem.getSatellites().forEach(satellite -> satellites.put(satellite.getId(), satellite));
        final var failures = new LinkedHashMap<String, String>();

        final var imagingActions = decoded.stream().map(DecodedTask::toImagingAction).toList();
        final var uplinks = scheduleUplinks(problem, imagingActions, failures);

        final var downlinkPlans = new ArrayList<DownlinkPlan>();
        for (final var task : decoded) {
            final var satellite = satellites.getOrDefault(task.getSatelliteId(),
                    new Satellite(task.getSatelliteId(), task.getSatelliteId(), null));
            final var result = scheduler.planHybridDownlink(satellite, task.getTask().getId(), task.getDataVolumeGb(),
                    downlinkCandidates(task));
            if (result.isSuccess()) {
                downlinkPlans.add(result.orElseThrow());
            } else {
                failures.merge(task.getTask().getId(), "downlink: " + result.getMessage(), (a, b) -> a + "; " + b);
            }
        }

        final var report = checker.validate(problem.getSatellites(), imagingActions, uplinks, scheduler.getScheduledDownlinks());
        final var plan = new MissionPlan(solution, optimizer.getStatistics(), imagingActions, uplinks,
                List.copyOf(downlinkPlans), report, failures);
        log.info(String.format("Mission plan: %d imaging, %d uplinks, %d downlink plans, %d failures, feasible=%s",
                imagingActions.size(), uplinks.size(), downlinkPlans.size(), failures.size(), plan.isFeasible()));
        return plan;
    }

    private List<UplinkAction> scheduleUplinks(PlanningProblem problem,
                                               List<ImagingAction> imagingActions,
                                               Map<String, String> failures) {
        final var result = new ArrayList<UplinkAction>();
        final var minGap = schedulerConfig.getMinGapAfterUplinkSec();
        UplinkPrecedenceConstraint.groupBySatellite(imagingActions).forEach((satelliteId, imagings) -> {
            final var windows = problem.getContactWindows().stream()
                    .filter(window -> window.getSatelliteId().equals(satelliteId))
                    .toList();
            final var taskIds = imagings.stream().map(ImagingAction::getId).toList();
            final var batch = scheduler.scheduleUplink(new UplinkRequest(satelliteId, taskIds, problem.getHorizonStart(),
                    TimeUtils.plusSeconds(imagings.get(0).getStartTime(), -minGap)), windows);
            if (batch.isSuccess()) {
                result.add(batch.orElseThrow());
                return;
            }
            for (final var imaging : imagings) {
                final var single = scheduler.scheduleUplink(new UplinkRequest(satelliteId, List.of(imaging.getId()),
                        problem.getHorizonStart(), TimeUtils.plusSeconds(imaging.getStartTime(), -minGap)), windows);
                if (single.isSuccess()) {
                    result.add(single.orElseThrow());
                } else {
                    failures.put(imaging.getId(), "uplink: " + single.getMessage());
                }
            }
        });
        return result;
    }

    private static List<AntennaWindow> downlinkCandidates(DecodedTask task) {
        final var opportunities = task.getTask().getDownlinkOpportunities();
        final var result = new ArrayList<AntennaWindow>();
        for (var i = task.getDownlinkIndex() - 1; i < opportunities.size(); i++) {
            final var window = opportunities.get(i);
            if (!window.getSatelliteId().equals(task.getSatelliteId())) continue;
            final var start = TimeUtils.max(window.getStartTime(), task.getEarliestDownlink());
            if (!start.isBefore(window.getEndTime())) continue;
            result.add(new AntennaWindow(window.getStationId(), window.getAntennaId(), window.getSatelliteId(),
                    start, window.getEndTime(), window.getMaxDataRateMbps()));
        }
        return result;
    }
}
