package org.satplan.optimizers;

import org.satplan.data.PlanningTask;
import org.satplan.data.Satellite;
import org.satplan.data.Solution;

import java.util.List;

public interface PlanningAlgorithm {

    String getName();

    Solution solve(List<? extends PlanningTask> tasks, List<Satellite> satellites);
}
