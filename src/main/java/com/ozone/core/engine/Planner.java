package com.ozone.core.engine;

import com.ozone.core.model.Plan;

/**
 * Decomposes an objective into an ordered plan of steps.
 * <p>
 * The decomposition strategy is external to the orchestrator; any bean implementing
 * this interface replaces the built-in {@link LinePlanner}.
 */
@FunctionalInterface
public interface Planner {

    /**
     * @param objective opaque caller-supplied description
     * @return the plan; an empty plan is treated as a planning failure
     * @throws PlanningException when the objective cannot be planned
     */
    Plan plan(String objective) throws PlanningException;
}
