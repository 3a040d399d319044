package com.planforge.usage.service;

import com.planforge.config.AppProperties;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class CostCalculator {

    private final Map<String, AppProperties.ModelPricing> pricing;

    public CostCalculator(AppProperties appProperties) {
        Map<String, AppProperties.ModelPricing> configured = appProperties.ai().pricing();
        this.pricing = configured == null ? Map.of() : Map.copyOf(configured);
    }

    /**
     * Cost in US cents, rounded. Models without configured pricing cost nothing.
     */
    public long costCents(String model, long inputTokens, long outputTokens) {
        AppProperties.ModelPricing modelPricing = model == null ? null : pricing.get(model);
        if (modelPricing == null) {
            return 0L;
        }
        double dollars = (inputTokens / 1_000_000.0) * modelPricing.inputCostPerMillion()
                + (outputTokens / 1_000_000.0) * modelPricing.outputCostPerMillion();
        return Math.round(dollars * 100);
    }
}
