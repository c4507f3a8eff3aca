package org.satplan.resolvers;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.satplan.constraints.ValidationReport;
import org.satplan.data.DownlinkPlan;
import org.satplan.data.ImagingAction;
import org.satplan.data.Solution;
import org.satplan.data.UplinkAction;
import org.satplan.optimizers.OptimizerStatistics;

import java.util.List;
import java.util.Map;

@Getter
@RequiredArgsConstructor
@SuppressWarnings("ClassCanBeRecord")
public class MissionPlan {
    private final Solution solution;
    private final OptimizerStatistics statistics;
    private final List<ImagingAction> imagingActions;
    private final List<UplinkAction> uplinkActions;
    private final List<DownlinkPlan> downlinkPlans;
    private final ValidationReport validationReport;
    private final Map<String, String> schedulingFailures;

    public boolean isFeasible() {
        return validationReport.isFeasible();
    }

    public int getDownlinkActionCount() {
        return downlinkPlans.stream().mapToInt(DownlinkPlan::getActionCount).sum();
    }
}
