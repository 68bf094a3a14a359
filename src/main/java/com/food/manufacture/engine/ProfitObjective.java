package com.food.manufacture.engine;

import com.food.manufacture.domain.Oil;
import com.food.manufacture.domain.ParameterKey;
import com.food.manufacture.model.LinearExpression;
import com.food.manufacture.model.Objective;
import com.food.manufacture.model.VariableRef;

/**
 * Profit = sales revenue - purchase cost - storage cost, maximized.
 */
class ProfitObjective {

    private final BuildContext ctx;

    ProfitObjective(BuildContext ctx) {
        this.ctx = ctx;
    }

    Objective build() {
        double salePrice = ctx.getParams().require(ParameterKey.PRODUCT_SALES_PRICE);
        double storageCost = ctx.getParams().require(ParameterKey.STORAGE_COST_PER_TON);

        LinearExpression.Builder profit = LinearExpression.builder();
        for (int t : ctx.periods()) {
            profit.add(VariableRef.produce(t), salePrice);
        }
        for (Oil oil : ctx.oils()) {
            for (int t : ctx.periods()) {
                profit.add(VariableRef.buy(oil.getId(), t), -ctx.getData().getPrices().priceOf(oil.getId(), t));
            }
        }
        for (Oil oil : ctx.oils()) {
            for (int t : ctx.periods()) {
                profit.add(VariableRef.stock(oil.getId(), t), -storageCost);
            }
        }
        return Objective.maximize(profit.build());
    }
}
