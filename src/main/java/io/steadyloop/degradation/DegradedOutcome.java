package io.steadyloop.degradation;

import io.steadyloop.util.Jsons;

import java.util.LinkedHashMap;
import java.util.Map;

public record DegradedOutcome(
        boolean success,
        String component,
        String workaroundName,
        String description,
        double qualityLoss,
        Object result
) {
    public String toJson() {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("degraded", true);
        doc.put("component", component);
        doc.put("workaround", workaroundName);
        doc.put("quality_loss", qualityLoss);
        doc.put("result", result);
        return Jsons.toCompactJson(doc);
    }
}
