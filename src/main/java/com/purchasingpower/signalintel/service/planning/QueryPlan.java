package com.purchasingpower.signalintel.service.planning;

import java.util.List;

/**
 * Search queries to run for one request.
 *
 * @param descriptive whether the input was treated as a description rather than a literal search
 * @param queries     never empty; a single entry equal to the input when no expansion happened
 * @param modelCost   USD spent generating the queries
 */
public record QueryPlan(boolean descriptive, List<String> queries, double modelCost) {

    public static QueryPlan literal(String query) {
        return new QueryPlan(false, List.of(query), 0.0);
    }
}
