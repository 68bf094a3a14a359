package com.food.manufacture.solver;

import com.food.manufacture.model.ProductionModel;

public interface PlanningSolver {
    Solution solve(ProductionModel model);
}
