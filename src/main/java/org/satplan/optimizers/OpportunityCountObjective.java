package org.satplan.optimizers;

import lombok.RequiredArgsConstructor;
import org.satplan.data.PlanningTask;

import java.util.List;

@RequiredArgsConstructor
public class OpportunityCountObjective implements ObjectiveFunction {
    private final List<? extends PlanningTask> tasks;

    @Override
    public double evaluate(AwcsatSolution solution) {
        var result = 0.0;
        final var count = Math.min(tasks.size(), solution.getTaskCount());
        for (var i = 0; i < count; i++) {
            final var task = tasks.get(i);
            final var imaging = solution.decodeImagingOpportunity(i, task.getImagingOpportunityCount());
            final var downlink = solution.decodeDownlinkOpportunity(i, task.getDownlinkOpportunityCount());
            if (imaging > 0 && downlink > 0) result += 1.0;
        }
        return result;
    }
}
