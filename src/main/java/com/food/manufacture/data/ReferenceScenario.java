package com.food.manufacture.data;

import com.food.manufacture.domain.Oil;
import com.food.manufacture.domain.OilCategory;
import com.food.manufacture.domain.PriceTable;
import com.food.manufacture.domain.ReferenceData;

import java.util.List;

/**
 * Oil catalog and January-June price forecast of the Food Manufacture case
 * (H. P. Williams, Model Building in Mathematical Programming, 12.1 / 12.2).
 * Prices are per ton.
 */
public final class ReferenceScenario {

    private ReferenceScenario() {
    }

    public static List<Oil> oils() {
        return List.of(
                Oil.builder().id("VEG1").category(OilCategory.VEGETABLE).hardness(8.8).build(),
                Oil.builder().id("VEG2").category(OilCategory.VEGETABLE).hardness(6.1).build(),
                Oil.builder().id("OIL1").category(OilCategory.NON_VEGETABLE).hardness(2.0).build(),
                Oil.builder().id("OIL2").category(OilCategory.NON_VEGETABLE).hardness(4.2).build(),
                Oil.builder().id("OIL3").category(OilCategory.NON_VEGETABLE).hardness(5.0).build());
    }

    public static PriceTable prices() {
        return PriceTable.builder()
                .series("VEG1", 110, 130, 110, 120, 100, 90)
                .series("VEG2", 120, 130, 140, 110, 120, 100)
                .series("OIL1", 130, 110, 130, 120, 150, 140)
                .series("OIL2", 110, 90, 100, 120, 110, 80)
                .series("OIL3", 115, 115, 95, 125, 105, 135)
                .build();
    }

    public static ReferenceData referenceData() {
        return ReferenceData.builder()
                .oils(oils())
                .prices(prices())
                .build();
    }
}
