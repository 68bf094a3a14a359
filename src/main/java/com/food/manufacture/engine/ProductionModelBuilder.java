package com.food.manufacture.engine;

import com.food.manufacture.domain.Oil;
import com.food.manufacture.domain.PlanningMode;
import com.food.manufacture.domain.PlanningParameters;
import com.food.manufacture.domain.ReferenceData;
import com.food.manufacture.model.ProductionModel;
import com.food.manufacture.model.VariableDeclaration;
import com.food.manufacture.model.VariableRef;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds the multi-period blending model from reference data.
 * <p>
 * Stateless: the same inputs always produce an equal model, with variables and
 * constraints in the same order. The continuous families come from
 * {@link ConstraintLibrary}; discrete mode adds the usage indicators and the
 * rules of {@link DiscreteLogicExtension} on top.
 */
@Slf4j
@Component
public class ProductionModelBuilder {

    private final ReferenceDataValidator validator = new ReferenceDataValidator();

    public ProductionModel build(ReferenceData data, PlanningParameters params, PlanningMode mode) {
        validator.validate(data, params, mode);
        BuildContext ctx = BuildContext.of(data, params);

        ProductionModel.Assembly model = ProductionModel.builder()
                .mode(mode)
                .oils(ctx.oils())
                .horizon(ctx.getHorizon());

        // Variables: Buy, Use, Stock per (oil, month), Produce per month
        for (Oil oil : ctx.oils()) {
            for (int t : ctx.periods()) {
                model.variable(VariableDeclaration.nonNegative(VariableRef.buy(oil.getId(), t)));
            }
        }
        for (Oil oil : ctx.oils()) {
            for (int t : ctx.periods()) {
                model.variable(VariableDeclaration.nonNegative(VariableRef.use(oil.getId(), t)));
            }
        }
        for (Oil oil : ctx.oils()) {
            double capacity = params.storageCapacityOf(oil.getId());
            for (int t : ctx.periods()) {
                model.variable(VariableDeclaration.bounded(VariableRef.stock(oil.getId(), t), capacity));
            }
        }
        for (int t : ctx.periods()) {
            model.variable(VariableDeclaration.nonNegative(VariableRef.produce(t)));
        }

        model.constraints(new ConstraintLibrary(ctx).all());

        if (mode == PlanningMode.DISCRETE) {
            DiscreteLogicExtension discrete = new DiscreteLogicExtension(ctx);
            model.variables(discrete.indicators());
            model.constraints(discrete.all());
        }

        ProductionModel built = model.objective(new ProfitObjective(ctx).build()).build();
        log.debug("Built {} model: {} oils x {} months, {} variables, {} constraints",
                mode, ctx.oils().size(), ctx.getHorizon().size(),
                built.getVariables().size(), built.getConstraints().size());
        return built;
    }
}
