package com.food.manufacture.model;

import com.food.manufacture.domain.Oil;
import com.food.manufacture.domain.PlanningHorizon;
import com.food.manufacture.domain.PlanningMode;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Assembled planning model: variable declarations, constraint families and the
 * profit objective. Immutable once built, so it can be handed to a solver and
 * inspected afterwards without copying.
 */
@Value
@Builder(builderClassName = "Assembly")
public class ProductionModel {
    @NonNull
    PlanningMode mode;

    @Singular
    List<Oil> oils;

    @NonNull
    PlanningHorizon horizon;

    @Singular
    List<VariableDeclaration> variables;

    @Singular
    List<LinearConstraint> constraints;

    @NonNull
    Objective objective;

    public List<LinearConstraint> constraintsOf(ConstraintFamily family) {
        return constraints.stream()
                .filter(c -> c.getFamily() == family)
                .collect(Collectors.toList());
    }

    public List<VariableDeclaration> variablesOf(VariableFamily family) {
        return variables.stream()
                .filter(v -> v.getRef().getFamily() == family)
                .collect(Collectors.toList());
    }

    public Optional<VariableDeclaration> findVariable(VariableRef ref) {
        return variables.stream().filter(v -> v.getRef().equals(ref)).findFirst();
    }

    public boolean isDiscrete() {
        return mode == PlanningMode.DISCRETE;
    }
}
