package com.example.potholereporter.service.estimation;

import com.example.potholereporter.model.RepairEstimate;
import com.example.potholereporter.model.Severity;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Static pricing table translating severity and area into repair material,
 * bag count and cost.
 */
public final class CostEstimator {

    private static final Map<Severity, MaterialPricing> PRICING = new EnumMap<>(Severity.class);

    static {
        PRICING.put(Severity.MINOR, new MaterialPricing("Cold Patch Asphalt", 350, 0.15));
        PRICING.put(Severity.MODERATE, new MaterialPricing("Cold Mix Asphalt", 480, 0.12));
        PRICING.put(Severity.SEVERE, new MaterialPricing("Hot Mix Asphalt", 650, 0.10));
        PRICING.put(Severity.CRITICAL, new MaterialPricing("Premium Hot Mix Asphalt", 850, 0.08));
    }

    private CostEstimator() {
    }

    public static RepairEstimate estimate(Severity severity, double totalAreaSquareMeters) {
        MaterialPricing pricing = pricingFor(severity);
        int bags = Math.max(1, (int) Math.ceil(totalAreaSquareMeters / pricing.coveragePerBag()));
        return new RepairEstimate(pricing.material(), bags, (long) bags * pricing.costPerBag());
    }

    public static MaterialPricing pricingFor(Severity severity) {
        Objects.requireNonNull(severity, "severity");
        MaterialPricing pricing = PRICING.get(severity);
        if (pricing == null) {
            throw new IllegalStateException("No pricing configured for severity " + severity);
        }
        return pricing;
    }

    public record MaterialPricing(String material, long costPerBag, double coveragePerBag) {
    }
}
