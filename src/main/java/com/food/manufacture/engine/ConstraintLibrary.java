package com.food.manufacture.engine;

import com.food.manufacture.domain.Oil;
import com.food.manufacture.domain.OilCategory;
import com.food.manufacture.domain.ParameterKey;
import com.food.manufacture.model.ConstraintFamily;
import com.food.manufacture.model.LinearConstraint;
import com.food.manufacture.model.LinearExpression;
import com.food.manufacture.model.Relation;
import com.food.manufacture.model.VariableRef;

import java.util.ArrayList;
import java.util.List;

/**
 * Constraint families shared by the continuous and discrete models. Each method
 * emits one constraint per element of the family's index set.
 */
class ConstraintLibrary {

    private final BuildContext ctx;

    ConstraintLibrary(BuildContext ctx) {
        this.ctx = ctx;
    }

    List<LinearConstraint> all() {
        List<LinearConstraint> constraints = new ArrayList<>();
        constraints.addAll(inventoryBalance());
        constraints.addAll(finalStockTarget());
        constraints.addAll(categoryCapacity());
        constraints.addAll(productionDefinition());
        constraints.addAll(hardnessLowerBound());
        constraints.addAll(hardnessUpperBound());
        return constraints;
    }

    /**
     * Stock[o,t] - Stock[o,t-1] - Buy[o,t] + Use[o,t] = 0, with the initial stock
     * moved to the right-hand side in the first period.
     */
    List<LinearConstraint> inventoryBalance() {
        double initialStock = ctx.getParams().require(ParameterKey.INITIAL_STOCK);
        List<LinearConstraint> constraints = new ArrayList<>();
        for (Oil oil : ctx.oils()) {
            String o = oil.getId();
            for (int t : ctx.periods()) {
                LinearExpression.Builder expr = LinearExpression.builder()
                        .add(VariableRef.stock(o, t), 1.0)
                        .add(VariableRef.buy(o, t), -1.0)
                        .add(VariableRef.use(o, t), 1.0);
                double rhs;
                if (ctx.getHorizon().isFirst(t)) {
                    rhs = initialStock;
                } else {
                    expr.add(VariableRef.stock(o, ctx.getHorizon().previous(t)), -1.0);
                    rhs = 0.0;
                }
                constraints.add(LinearConstraint.of(ConstraintFamily.BALANCE, List.of(o, t),
                        expr.build(), Relation.EQUAL, rhs));
            }
        }
        return constraints;
    }

    List<LinearConstraint> finalStockTarget() {
        double target = ctx.getParams().require(ParameterKey.TARGET_FINAL_STOCK);
        int last = ctx.getHorizon().last();
        List<LinearConstraint> constraints = new ArrayList<>();
        for (Oil oil : ctx.oils()) {
            LinearExpression expr = LinearExpression.builder().add(VariableRef.stock(oil.getId(), last)).build();
            constraints.add(LinearConstraint.of(ConstraintFamily.FINAL_STOCK, List.of(oil.getId()),
                    expr, Relation.EQUAL, target));
        }
        return constraints;
    }

    /**
     * A category without member oils still gets its (empty) constraint.
     */
    List<LinearConstraint> categoryCapacity() {
        List<LinearConstraint> constraints = new ArrayList<>();
        for (int t : ctx.periods()) {
            for (OilCategory category : OilCategory.values()) {
                double cap = ctx.getParams().require(category.capacityKey());
                LinearExpression.Builder expr = LinearExpression.builder();
                ctx.getCategories().members(category).forEach(oil -> expr.add(VariableRef.use(oil.getId(), t)));
                constraints.add(LinearConstraint.of(ConstraintFamily.CATEGORY_CAPACITY, List.of(category, t),
                        expr.build(), Relation.LESS_EQUAL, cap));
            }
        }
        return constraints;
    }

    List<LinearConstraint> productionDefinition() {
        List<LinearConstraint> constraints = new ArrayList<>();
        for (int t : ctx.periods()) {
            LinearExpression.Builder expr = LinearExpression.builder().add(VariableRef.produce(t), 1.0);
            ctx.oils().forEach(oil -> expr.add(VariableRef.use(oil.getId(), t), -1.0));
            constraints.add(LinearConstraint.of(ConstraintFamily.PRODUCTION_DEFINITION, List.of(t),
                    expr.build(), Relation.EQUAL, 0.0));
        }
        return constraints;
    }

    // sum(h[o] * Use[o,t]) >= min * Produce[t], i.e. the weighted average multiplied through by Produce[t]
    List<LinearConstraint> hardnessLowerBound() {
        return hardnessBound(ConstraintFamily.HARDNESS_MIN,
                ctx.getParams().require(ParameterKey.MIN_HARDNESS), Relation.GREATER_EQUAL);
    }

    List<LinearConstraint> hardnessUpperBound() {
        return hardnessBound(ConstraintFamily.HARDNESS_MAX,
                ctx.getParams().require(ParameterKey.MAX_HARDNESS), Relation.LESS_EQUAL);
    }

    private List<LinearConstraint> hardnessBound(ConstraintFamily family, double bound, Relation relation) {
        List<LinearConstraint> constraints = new ArrayList<>();
        for (int t : ctx.periods()) {
            LinearExpression.Builder expr = LinearExpression.builder();
            for (Oil oil : ctx.oils()) {
                expr.add(VariableRef.use(oil.getId(), t), oil.getHardness());
            }
            expr.add(VariableRef.produce(t), -bound);
            constraints.add(LinearConstraint.of(family, List.of(t), expr.build(), relation, 0.0));
        }
        return constraints;
    }
}
