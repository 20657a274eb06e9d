package com.playpulse.analytics.parse;

import com.fasterxml.jackson.databind.JsonNode;

import com.playpulse.analytics.model.SegmentSpec;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses segment specs from finalize requests and the spec catalog. Specs are rejected, never
 * repaired: inverted or out-of-unit ranges and non-positive durations fail with the field named.
 */
public final class SegmentSpecParser {
    private SegmentSpecParser() {}

    public static List<SegmentSpec> parseList(JsonNode array, String field) throws TelemetryValidationException {
        ParseSupport.requireArray(array, field);
        List<SegmentSpec> specs = new ArrayList<>(array.size());
        Set<String> names = new HashSet<>();
        for (int i = 0; i < array.size(); i++) {
            String path = ParseSupport.element(field, i);
            SegmentSpec spec = parse(array.get(i), path);
            if (!names.add(spec.name)) {
                throw new TelemetryValidationException(path + ".name", "duplicate segment name '" + spec.name + "'");
            }
            specs.add(spec);
        }
        return specs;
    }

    public static SegmentSpec parse(JsonNode node, String field) throws TelemetryValidationException {
        if (node == null || !node.isObject()) {
            throw new TelemetryValidationException(field, "expected a segment spec object");
        }
        SegmentSpec spec = new SegmentSpec();
        spec.name = JsonNodeUtils.requireText(node.path("name"), field + ".name");
        spec.targetDimension = JsonNodeUtils.requireText(node.path("target_dimension"), field + ".target_dimension");

        JsonNode range = node.path("acceptable_range");
        String rangeField = field + ".acceptable_range";
        if (!range.isArray() || range.size() != 2) {
            throw new TelemetryValidationException(rangeField, "expected [lo, hi]");
        }
        spec.rangeLow = JsonNodeUtils.requireUnitInterval(range.get(0), rangeField + "[0]");
        spec.rangeHigh = JsonNodeUtils.requireUnitInterval(range.get(1), rangeField + "[1]");
        if (spec.rangeLow > spec.rangeHigh) {
            throw new TelemetryValidationException(rangeField,
                    "lower bound " + spec.rangeLow + " exceeds upper bound " + spec.rangeHigh);
        }

        String durationField = field + ".expected_duration_sec";
        spec.expectedDurationSec = JsonNodeUtils.requireDouble(node.path("expected_duration_sec"), durationField);
        if (spec.expectedDurationSec <= 0.0) {
            throw new TelemetryValidationException(durationField, "must be > 0, got " + spec.expectedDurationSec);
        }

        spec.description = JsonNodeUtils.asNullableText(node.path("description"));
        spec.visualCues = textList(node.path("visual_cues"));
        spec.failureIndicators = textList(node.path("failure_indicators"));
        spec.successIndicators = textList(node.path("success_indicators"));
        return spec;
    }

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node != null && node.isArray()) {
            for (JsonNode item : node) {
                String text = JsonNodeUtils.asNullableText(item);
                if (text != null) {
                    values.add(text);
                }
            }
        }
        return values;
    }
}
