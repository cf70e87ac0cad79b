package com.folio.backend.service.analytics;

import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class AllocationValidator {

    public static final double SUM_TOLERANCE = 1e-6;

    /**
     * @return every rule the proposed weights break; empty when they are acceptable
     */
    public List<String> validate(Map<String, Double> weights) {
        List<String> violations = new ArrayList<>();
        if (weights == null || weights.isEmpty()) {
            violations.add("at least one weight is required");
            return violations;
        }
        double sum = 0.0;
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            String ticker = entry.getKey();
            Double weight = entry.getValue();
            if (ticker == null || ticker.isBlank()) {
                violations.add("ticker must not be blank");
            }
            if (weight == null || weight.isNaN()) {
                violations.add("weight for " + ticker + " is missing");
                continue;
            }
            if (weight < 0.0 || weight > 1.0) {
                violations.add("weight for " + ticker + " must be within [0, 1] but was " + weight);
            }
            sum += weight;
        }
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            violations.add(String.format("weights must sum to 1.0 but sum to %.6f", sum));
        }
        return violations;
    }

    public boolean isValid(Map<String, Double> weights) {
        return validate(weights).isEmpty();
    }
}
