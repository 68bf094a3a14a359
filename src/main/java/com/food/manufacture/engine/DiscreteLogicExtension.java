package com.food.manufacture.engine;

import com.food.manufacture.domain.Oil;
import com.food.manufacture.domain.OilDependency;
import com.food.manufacture.domain.ParameterKey;
import com.food.manufacture.model.ConstraintFamily;
import com.food.manufacture.model.LinearConstraint;
import com.food.manufacture.model.LinearExpression;
import com.food.manufacture.model.Relation;
import com.food.manufacture.model.VariableDeclaration;
import com.food.manufacture.model.VariableRef;

import java.util.ArrayList;
import java.util.List;

/**
 * Usage indicators and the logical rules built on them. Only applied to models
 * built in discrete mode.
 */
class DiscreteLogicExtension {

    private final BuildContext ctx;

    DiscreteLogicExtension(BuildContext ctx) {
        this.ctx = ctx;
    }

    List<VariableDeclaration> indicators() {
        List<VariableDeclaration> variables = new ArrayList<>();
        for (Oil oil : ctx.oils()) {
            for (int t : ctx.periods()) {
                variables.add(VariableDeclaration.binary(VariableRef.isUsed(oil.getId(), t)));
            }
        }
        return variables;
    }

    List<LinearConstraint> all() {
        List<LinearConstraint> constraints = new ArrayList<>();
        constraints.addAll(linking());
        constraints.addAll(minimumThreshold());
        constraints.addAll(maxIngredients());
        constraints.addAll(logicalImplication());
        return constraints;
    }

    /**
     * Largest quantity of {@code oil} that can be refined in one month: the cap of its
     * refining category.
     */
    double bigM(Oil oil) {
        return ctx.getParams().require(oil.getCategory().capacityKey());
    }

    // Use[o,t] - M * IsUsed[o,t] <= 0
    List<LinearConstraint> linking() {
        List<LinearConstraint> constraints = new ArrayList<>();
        for (Oil oil : ctx.oils()) {
            double bigM = bigM(oil);
            for (int t : ctx.periods()) {
                LinearExpression expr = LinearExpression.builder()
                        .add(VariableRef.use(oil.getId(), t), 1.0)
                        .add(VariableRef.isUsed(oil.getId(), t), -bigM)
                        .build();
                constraints.add(LinearConstraint.of(ConstraintFamily.LINKING, List.of(oil.getId(), t),
                        expr, Relation.LESS_EQUAL, 0.0));
            }
        }
        return constraints;
    }

    // Use[o,t] - min * IsUsed[o,t] >= 0
    List<LinearConstraint> minimumThreshold() {
        double minUsage = ctx.getParams().require(ParameterKey.MIN_USAGE_IF_USED);
        List<LinearConstraint> constraints = new ArrayList<>();
        for (Oil oil : ctx.oils()) {
            for (int t : ctx.periods()) {
                LinearExpression expr = LinearExpression.builder()
                        .add(VariableRef.use(oil.getId(), t), 1.0)
                        .add(VariableRef.isUsed(oil.getId(), t), -minUsage)
                        .build();
                constraints.add(LinearConstraint.of(ConstraintFamily.MIN_THRESHOLD, List.of(oil.getId(), t),
                        expr, Relation.GREATER_EQUAL, 0.0));
            }
        }
        return constraints;
    }

    List<LinearConstraint> maxIngredients() {
        double maxIngredients = ctx.getParams().require(ParameterKey.MAX_INGREDIENTS_PER_MONTH);
        List<LinearConstraint> constraints = new ArrayList<>();
        for (int t : ctx.periods()) {
            LinearExpression.Builder expr = LinearExpression.builder();
            ctx.oils().forEach(oil -> expr.add(VariableRef.isUsed(oil.getId(), t)));
            constraints.add(LinearConstraint.of(ConstraintFamily.MAX_INGREDIENTS, List.of(t),
                    expr.build(), Relation.LESS_EQUAL, maxIngredients));
        }
        return constraints;
    }

    // IsUsed[dependent,t] <= IsUsed[prerequisite,t]
    List<LinearConstraint> logicalImplication() {
        List<LinearConstraint> constraints = new ArrayList<>();
        for (OilDependency dependency : ctx.getParams().getDependencies()) {
            for (int t : ctx.periods()) {
                LinearExpression expr = LinearExpression.builder()
                        .add(VariableRef.isUsed(dependency.getDependent(), t), 1.0)
                        .add(VariableRef.isUsed(dependency.getPrerequisite(), t), -1.0)
                        .build();
                constraints.add(LinearConstraint.of(ConstraintFamily.LOGICAL_IMPLICATION,
                        List.of(dependency.getDependent(), dependency.getPrerequisite(), t),
                        expr, Relation.LESS_EQUAL, 0.0));
            }
        }
        return constraints;
    }
}
