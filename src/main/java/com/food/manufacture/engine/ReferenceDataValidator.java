package com.food.manufacture.engine;

import com.food.manufacture.domain.Oil;
import com.food.manufacture.domain.OilDependency;
import com.food.manufacture.domain.ParameterKey;
import com.food.manufacture.domain.PlanningMode;
import com.food.manufacture.domain.PlanningParameters;
import com.food.manufacture.domain.ReferenceData;
import com.food.manufacture.domain.ValidationException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.SortedSet;

/**
 * Checks that reference data and parameters are complete for the requested mode.
 * Collects every problem and reports them together in one {@link ValidationException}.
 */
public class ReferenceDataValidator {

    public void validate(ReferenceData data, PlanningParameters params, PlanningMode mode) {
        List<String> problems = new ArrayList<>();
        checkCatalog(data, problems);
        checkPrices(data, problems);
        checkParameters(params, mode, problems);
        checkOilReferences(data, params, mode, problems);
        if (!problems.isEmpty()) {
            throw new ValidationException(problems);
        }
    }

    private void checkCatalog(ReferenceData data, List<String> problems) {
        if (data.getOils().isEmpty()) {
            problems.add("Oil catalog is empty");
        }
        Set<String> seen = new HashSet<>();
        for (Oil oil : data.getOils()) {
            if (!seen.add(oil.getId())) {
                problems.add("Duplicate oil id '" + oil.getId() + "'");
            }
            if (!(oil.getHardness() >= 0) || Double.isInfinite(oil.getHardness())) {
                problems.add("Hardness of " + oil.getId() + " must be a non-negative number, got " + oil.getHardness());
            }
        }
    }

    private void checkPrices(ReferenceData data, List<String> problems) {
        SortedSet<Integer> periods = data.getPrices().periods();
        if (periods.isEmpty()) {
            problems.add("Price table defines no periods");
            return;
        }
        int expected = periods.first();
        for (int period : periods) {
            if (period != expected) {
                problems.add("Periods must be consecutive, period " + expected + " is missing");
                break;
            }
            expected++;
        }
        for (Oil oil : data.getOils()) {
            for (int period : periods) {
                OptionalDouble price = data.getPrices().find(oil.getId(), period);
                if (price.isEmpty()) {
                    problems.add("No purchase price for " + oil.getId() + " in period " + period);
                } else if (!(price.getAsDouble() > 0) || Double.isInfinite(price.getAsDouble())) {
                    problems.add("Purchase price for " + oil.getId() + " in period " + period
                            + " must be positive, got " + price.getAsDouble());
                }
            }
        }
    }

    private void checkParameters(PlanningParameters params, PlanningMode mode, List<String> problems) {
        for (ParameterKey key : ParameterKey.values()) {
            if (!key.isRequiredFor(mode)) {
                continue;
            }
            OptionalDouble value = params.find(key);
            if (value.isEmpty()) {
                problems.add("Missing parameter '" + key.key() + "' required in " + mode + " mode");
            } else if (!(value.getAsDouble() >= 0) || Double.isInfinite(value.getAsDouble())) {
                problems.add("Parameter '" + key.key() + "' must be a non-negative number, got " + value.getAsDouble());
            }
        }
        OptionalDouble min = params.find(ParameterKey.MIN_HARDNESS);
        OptionalDouble max = params.find(ParameterKey.MAX_HARDNESS);
        if (min.isPresent() && max.isPresent() && min.getAsDouble() > max.getAsDouble()) {
            problems.add("min_hardness " + min.getAsDouble() + " exceeds max_hardness " + max.getAsDouble());
        }
    }

    private void checkOilReferences(ReferenceData data, PlanningParameters params, PlanningMode mode,
                                    List<String> problems) {
        params.getStorageCapacities().forEach((oilId, capacity) -> {
            if (data.findOil(oilId).isEmpty()) {
                problems.add("Storage capacity given for unknown oil '" + oilId + "'");
            }
            if (!(capacity >= 0)) {
                problems.add("Storage capacity of " + oilId + " must be non-negative, got " + capacity);
            }
        });
        if (mode != PlanningMode.DISCRETE) {
            return;
        }
        for (OilDependency dependency : params.getDependencies()) {
            if (data.findOil(dependency.getDependent()).isEmpty()) {
                problems.add("Dependency names unknown oil '" + dependency.getDependent() + "'");
            }
            if (data.findOil(dependency.getPrerequisite()).isEmpty()) {
                problems.add("Dependency names unknown oil '" + dependency.getPrerequisite() + "'");
            }
        }
    }
}
