package com.stream.capacity.topograph.service.plan;

import com.stream.capacity.topograph.dto.plan.LogicalPlan;
import com.stream.capacity.topograph.dto.plan.PhysicalPlan;

/**
 * Supplies the plan documents of a running topology. The tracker address is bound when the source is created.
 * Failures raise {@link com.stream.capacity.topograph.exception.PlanFetchException}.
 */
public interface PlanSource {

    LogicalPlan getLogicalPlan(String cluster, String environ, String topologyId);

    PhysicalPlan getPhysicalPlan(String cluster, String environ, String topologyId);
}
