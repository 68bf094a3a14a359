package com.food.manufacture.service;

import com.food.manufacture.domain.PlanRecord;
import com.food.manufacture.domain.PlanningOutcome;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * Renders an outcome as console text: profit, then month x oil pivot tables.
 */
public class PlanReportFormatter {

    public String format(PlanningOutcome outcome, String title) {
        StringBuilder sb = new StringBuilder();
        sb.append("\n--- ").append(title).append(" ---\n");
        sb.append("Status: ").append(outcome.getStatus()).append('\n');
        if (!outcome.isFeasible()) {
            return sb.toString();
        }
        sb.append(String.format(Locale.ROOT, "Total Profit: %,.2f%n", outcome.getObjectiveValue()));
        sb.append("\nRefining Plan (Tons Used):\n");
        sb.append(pivot(outcome.getRecords(), PlanRecord::getUse));
        sb.append("\nBuying Plan (Tons Bought):\n");
        sb.append(pivot(outcome.getRecords(), PlanRecord::getBuy));
        return sb.toString();
    }

    /**
     * One row per month, one column per oil, values rounded to one decimal.
     */
    public String pivot(List<PlanRecord> records, ToDoubleFunction<PlanRecord> column) {
        Set<String> oils = new LinkedHashSet<>();
        Map<Integer, Map<String, Double>> rows = new LinkedHashMap<>();
        for (PlanRecord r : records) {
            oils.add(r.getOil());
            rows.computeIfAbsent(r.getPeriod(), p -> new LinkedHashMap<>()).put(r.getOil(), column.applyAsDouble(r));
        }

        List<String> lines = new ArrayList<>();
        StringBuilder header = new StringBuilder(String.format(Locale.ROOT, "%-6s", "Month"));
        oils.forEach(o -> header.append(String.format(Locale.ROOT, "%9s", o)));
        lines.add(header.toString());
        rows.forEach((period, values) -> {
            StringBuilder line = new StringBuilder(String.format(Locale.ROOT, "%-6d", period));
            oils.forEach(o -> line.append(String.format(Locale.ROOT, "%9.1f", round(values.getOrDefault(o, 0.0)))));
            lines.add(line.toString());
        });
        return String.join("\n", lines) + "\n";
    }

    // -0.0 from solver noise prints as 0.0
    private static double round(double value) {
        double rounded = Math.round(value * 10.0) / 10.0;
        return rounded == 0.0 ? 0.0 : rounded;
    }
}
