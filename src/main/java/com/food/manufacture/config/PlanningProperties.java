package com.food.manufacture.config;

import com.food.manufacture.domain.OilDependency;
import com.food.manufacture.domain.ParameterKey;
import com.food.manufacture.domain.PlanningParameters;
import com.food.manufacture.domain.ValidationException;
import com.food.manufacture.solver.SolverSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Planning scenario configuration, bound from the {@code planning.*} properties.
 */
@Data
@ConfigurationProperties(prefix = "planning")
public class PlanningProperties {

    /**
     * Scalar parameters keyed by name, e.g. {@code min-hardness: 3.0}.
     */
    private Map<String, Double> parameters = new LinkedHashMap<>();

    /**
     * Per-oil storage capacities overriding {@code storage-capacity-per-oil}.
     */
    private List<StorageCapacity> storageCapacities = new ArrayList<>();

    /**
     * Oil dependency rules applied in discrete mode.
     */
    private List<Dependency> dependencies = new ArrayList<>();

    private Solver solver = new Solver();

    public PlanningParameters toParameters() {
        PlanningParameters.PlanningParametersBuilder builder = PlanningParameters.builder();
        List<String> unknown = new ArrayList<>();
        parameters.forEach((name, value) -> ParameterKey.fromKey(name).ifPresentOrElse(
                key -> builder.value(key, value),
                () -> unknown.add("Unknown parameter '" + name + "'")));
        if (!unknown.isEmpty()) {
            throw new ValidationException(unknown);
        }
        storageCapacities.forEach(c -> builder.storageCapacity(c.getOil(), c.getTons()));
        dependencies.forEach(d -> builder.dependency(new OilDependency(d.getDependent(), d.getPrerequisite())));
        return builder.build();
    }

    @Data
    public static class StorageCapacity {
        private String oil;
        private double tons;
    }

    @Data
    public static class Dependency {
        private String dependent;
        private String prerequisite;
    }

    @Data
    public static class Solver {
        private String lpBackend = "GLOP";
        private String mipBackend = "SCIP";

        /**
         * Wall-clock limit per solve in seconds, 0 for none.
         */
        private double timeLimitSec = 0;

        private double relativeMipGap = 1e-7;

        /**
         * Tolerance used when re-checking solver output against the model.
         */
        private double verificationTolerance = 1e-5;

        public SolverSettings toSettings() {
            return SolverSettings.builder()
                    .lpBackend(lpBackend)
                    .mipBackend(mipBackend)
                    .timeLimitSec(timeLimitSec)
                    .relativeMipGap(relativeMipGap)
                    .build();
        }
    }
}
