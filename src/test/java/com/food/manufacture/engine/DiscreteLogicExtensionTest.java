package com.food.manufacture.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.food.manufacture.data.ReferenceScenario;
import com.food.manufacture.domain.Oil;
import com.food.manufacture.domain.OilDependency;
import com.food.manufacture.domain.ParameterKey;
import com.food.manufacture.domain.PlanningParameters;
import com.food.manufacture.model.LinearConstraint;
import com.food.manufacture.model.Relation;
import com.food.manufacture.model.VariableFamily;
import com.food.manufacture.model.VariableRef;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.Test;

final class DiscreteLogicExtensionTest {

    private final DiscreteLogicExtension extension = extensionFor(PlanningParameters.reference());

    @Test
    void bigMFollowsTheOilsCategoryCap() {
        assertEquals(200.0, extension.bigM(oil("VEG1")));
        assertEquals(250.0, extension.bigM(oil("OIL2")));

        DiscreteLogicExtension widened = extensionFor(PlanningParameters.reference().toBuilder()
                .value(ParameterKey.MAX_NONVEG_REFINE_PER_MONTH, 400.0)
                .build());
        assertEquals(400.0, widened.bigM(oil("OIL2")));
        assertEquals(-400.0, find(widened.linking(), "LinkVars[OIL2,1]")
                .getExpression().coefficientOf(VariableRef.isUsed("OIL2", 1)));
    }

    @Test
    void linkingForcesIndicatorWheneverOilIsUsed() {
        LinearConstraint link = find(extension.linking(), "LinkVars[VEG2,5]");

        assertEquals(Relation.LESS_EQUAL, link.getRelation());
        // Full category throughput is still allowed with the indicator on
        assertTrue(link.isSatisfied(values(200.0, 1.0), 1e-9));
        assertFalse(link.isSatisfied(values(0.5, 0.0), 1e-9));
        assertTrue(link.isSatisfied(values(0.0, 0.0), 1e-9));
    }

    @Test
    void thresholdForbidsTokenUsage() {
        LinearConstraint threshold = find(extension.minimumThreshold(), "MinThreshold[VEG2,5]");

        assertEquals(Relation.GREATER_EQUAL, threshold.getRelation());
        assertFalse(threshold.isSatisfied(values(5.0, 1.0), 1e-9));
        assertTrue(threshold.isSatisfied(values(20.0, 1.0), 1e-9));
        assertTrue(threshold.isSatisfied(values(0.0, 0.0), 1e-9));
    }

    @Test
    void maxIngredientsCountsIndicatorsPerMonth() {
        List<LinearConstraint> maxIngredients = extension.maxIngredients();

        assertEquals(6, maxIngredients.size());
        LinearConstraint january = maxIngredients.get(0);
        assertEquals("MaxIngredients[1]", january.name());
        assertEquals(3.0, january.getRhs());
        assertEquals(5, january.getExpression().terms().size());
        assertTrue(january.getExpression().terms().keySet().stream().allMatch(r -> r.getPeriod() == 1));
    }

    @Test
    void implicationUsesConfiguredPairs() {
        List<LinearConstraint> rules = extension.logicalImplication();

        LinearConstraint rule = find(rules, "LogicalImplication[VEG1,OIL3,2]");
        assertEquals(Map.of(VariableRef.isUsed("VEG1", 2), 1.0, VariableRef.isUsed("OIL3", 2), -1.0),
                rule.getExpression().terms());
        assertEquals(0.0, rule.getRhs());

        DiscreteLogicExtension custom = extensionFor(PlanningParameters.reference().toBuilder()
                .clearDependencies()
                .dependency(new OilDependency("OIL1", "OIL2"))
                .build());
        List<LinearConstraint> customRules = custom.logicalImplication();
        assertEquals(6, customRules.size());
        assertTrue(customRules.stream().allMatch(c -> c.name().startsWith("LogicalImplication[OIL1,OIL2,")));

        DiscreteLogicExtension none = extensionFor(PlanningParameters.reference().toBuilder()
                .clearDependencies()
                .build());
        assertTrue(none.logicalImplication().isEmpty());
    }

    @Test
    void indicatorsCoverEveryOilAndMonth() {
        assertEquals(30, extension.indicators().size());
        assertEquals(30 + 30 + 6 + 12, extension.all().size());
    }

    private static Function<VariableRef, Double> values(double use, double isUsed) {
        return ref -> ref.getFamily() == VariableFamily.USE ? use : isUsed;
    }

    private static DiscreteLogicExtension extensionFor(PlanningParameters params) {
        return new DiscreteLogicExtension(BuildContext.of(ReferenceScenario.referenceData(), params));
    }

    private static Oil oil(String id) {
        return ReferenceScenario.referenceData().findOil(id).orElseThrow();
    }

    private static LinearConstraint find(List<LinearConstraint> constraints, String name) {
        return constraints.stream()
                .filter(c -> c.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No constraint " + name));
    }
}
