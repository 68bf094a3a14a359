package com.food.manufacture.config;

import com.food.manufacture.domain.PlanningParameters;
import com.food.manufacture.service.PlanExtractor;
import com.food.manufacture.service.PlanReportFormatter;
import com.food.manufacture.solver.ModelEvaluator;
import com.food.manufacture.solver.OrToolsPlanningSolver;
import com.food.manufacture.solver.PlanningSolver;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(PlanningProperties.class)
public class PlanningConfiguration {

    @Bean
    public PlanningSolver planningSolver(PlanningProperties properties) {
        return new OrToolsPlanningSolver(properties.getSolver().toSettings());
    }

    @Bean
    public ModelEvaluator modelEvaluator(PlanningProperties properties) {
        return new ModelEvaluator(properties.getSolver().getVerificationTolerance());
    }

    @Bean
    public PlanExtractor planExtractor() {
        return new PlanExtractor();
    }

    @Bean
    public PlanReportFormatter planReportFormatter() {
        return new PlanReportFormatter();
    }

    @Bean
    public PlanningParameters planningParameters(PlanningProperties properties) {
        return properties.toParameters();
    }
}
