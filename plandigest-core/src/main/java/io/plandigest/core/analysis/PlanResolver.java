package io.plandigest.core.analysis;

import io.plandigest.core.model.Plan;
import io.plandigest.core.source.RecordSource;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves plan identifiers referenced by runs. Identifiers that could not be fetched resolve to a
 * display-only placeholder that is never added to the fetched plans.
 */
public final class PlanResolver {
    private static final Logger LOG = LoggerFactory.getLogger(PlanResolver.class);
    private static final int PLACEHOLDER_ID_CHARS = 8;

    private final Map<String, Plan> plans;
    private final Clock clock;

    public PlanResolver(Map<String, Plan> plans, Clock clock) {
        this.plans = plans == null ? Map.of() : Map.copyOf(plans);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public static PlanResolver fetch(RecordSource source, Collection<String> planIds, Clock clock) {
        Objects.requireNonNull(source, "source must not be null");
        Set<String> distinct = new TreeSet<>();
        for (String planId : planIds) {
            if (planId != null && !planId.isBlank()) {
                distinct.add(planId);
            }
        }

        Map<String, Plan> resolved = new LinkedHashMap<>();
        for (String planId : distinct) {
            try {
                Plan plan = source.getPlan(planId);
                if (plan != null) {
                    resolved.put(planId, plan);
                }
            } catch (Exception e) {
                LOG.warn("Plan lookup failed for {}, using placeholder: {}", planId, e.getMessage());
            }
        }
        LOG.debug("Resolved {}/{} plans from {}", resolved.size(), distinct.size(), source.name());
        return new PlanResolver(resolved, clock);
    }

    public static Plan placeholder(String planId, Instant now) {
        String id = planId == null ? "" : planId;
        String prefix = id.substring(0, Math.min(PLACEHOLDER_ID_CHARS, id.length()));
        return new Plan(id, "Plan " + prefix, null, now, now);
    }

    public Plan resolve(String planId) {
        Plan plan = plans.get(planId);
        if (plan != null) {
            return plan;
        }
        return placeholder(planId, clock.instant());
    }

    public String nameOf(String planId) {
        Plan plan = resolve(planId);
        if (plan.name().isBlank()) {
            return placeholder(planId, clock.instant()).name();
        }
        return plan.name();
    }

    public boolean isKnown(String planId) {
        return plans.containsKey(planId);
    }

    public int knownCount() {
        return plans.size();
    }
}
