package com.food.manufacture.solver;

import com.food.manufacture.model.LinearConstraint;
import com.food.manufacture.model.ProductionModel;
import com.food.manufacture.model.VariableDeclaration;
import com.food.manufacture.model.VariableDomain;
import com.food.manufacture.model.VariableRef;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Checks an assignment against every bound, integrality requirement and constraint
 * of a model, independently of any solver.
 */
public class ModelEvaluator {

    public static final double DEFAULT_TOLERANCE = 1e-6;

    private final double tolerance;

    public ModelEvaluator() {
        this(DEFAULT_TOLERANCE);
    }

    public ModelEvaluator(double tolerance) {
        this.tolerance = tolerance;
    }

    /**
     * Returns one message per violation; an empty list means the assignment is feasible.
     */
    public List<String> violations(ProductionModel model, Map<VariableRef, Double> values) {
        List<String> violations = new ArrayList<>();
        for (VariableDeclaration declaration : model.getVariables()) {
            Double value = values.get(declaration.getRef());
            String name = declaration.getRef().name();
            if (value == null) {
                violations.add(name + " has no value");
                continue;
            }
            if (value < declaration.getLowerBound() - tolerance || value > declaration.getUpperBound() + tolerance) {
                violations.add(String.format(Locale.ROOT, "%s = %.6f outside [%s, %s]", name, value,
                        declaration.getLowerBound(), declaration.getUpperBound()));
            }
            if (declaration.getDomain() == VariableDomain.BINARY && Math.abs(value - Math.rint(value)) > tolerance) {
                violations.add(String.format(Locale.ROOT, "%s = %.6f is not integral", name, value));
            }
        }
        if (!violations.isEmpty()) {
            return violations;
        }
        for (LinearConstraint constraint : model.getConstraints()) {
            double activity = constraint.getExpression().evaluate(values::get);
            if (!constraint.getRelation().holds(activity, constraint.getRhs(), tolerance)) {
                violations.add(String.format(Locale.ROOT, "%s: activity %.6f %s %s does not hold", constraint.name(), activity,
                        constraint.getRelation().symbol(), constraint.getRhs()));
            }
        }
        return violations;
    }

    public boolean isFeasible(ProductionModel model, Map<VariableRef, Double> values) {
        return violations(model, values).isEmpty();
    }

    public double objectiveValue(ProductionModel model, Map<VariableRef, Double> values) {
        return model.getObjective().getExpression().evaluate(values::get);
    }
}
