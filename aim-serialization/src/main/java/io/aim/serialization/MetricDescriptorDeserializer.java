package io.aim.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.aim.core.metric.model.Icon;
import io.aim.core.metric.model.MetricDescriptor;
import io.aim.core.metric.model.Reference;
import io.aim.core.metric.model.ResultDescriptor;
import io.aim.core.metric.model.ScoreBand;
import io.aim.core.metric.model.ScoreRange;
import io.aim.core.metric.model.Speed;
import io.aim.core.metric.model.ValueType;
import io.aim.core.metric.model.VisualizationType;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.List;

/// Reads one metric entry of a registry document.
///
/// All nested types (`ResultDescriptor`, `ScoreBand`, `ScoreRange`, `Icon`)
/// are extracted manually from the `JsonNode` tree. Document quirks handled here:
/// - `description: false` on a result means no description
/// - `range: [min, max]` where either bound may be `null` (unbounded)
/// - `icon: [set, name]` where both may be `null`
/// - a band without `judgment` gets an empty label
///
/// Cross-field rules (contiguous indices, shadowed bands) are left to
/// {@link io.aim.core.metric.MetricRegistryValidator}.
///
/// @see MetricDescriptorSerializer for the inverse operation
class MetricDescriptorDeserializer extends StdDeserializer<MetricDescriptor> {

    @Serial private static final long serialVersionUID = 3071950418120563392L;

    MetricDescriptorDeserializer() {
        super(MetricDescriptor.class);
    }

    @Override
    public MetricDescriptor deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        JsonNode root = p.getCodec().readTree(p);
        String id = requireText(p, root, "id", "Metric");
        String where = "Metric '" + id + "'";

        MetricDescriptor.Builder builder =
                MetricDescriptor.builder()
                        .id(id)
                        .categoryId(requireText(p, root, "category", where))
                        .name(requireText(p, root, "name", where))
                        .description(optionalText(root, "description"))
                        .evidence(requireInt(p, root, "evidence", where))
                        .relevance(requireInt(p, root, "relevance", where));
        int speed = requireInt(p, root, "speed", where);
        try {
            builder.speed(Speed.fromRating(speed));
            if (root.hasNonNull("visualizationType")) {
                builder.visualizationType(VisualizationType.fromCode(root.get("visualizationType").asText()));
            }
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(p, where + ": " + e.getMessage(), e);
        }

        for (JsonNode reference : root.path("references")) {
            builder.reference(
                    new Reference(optionalText(reference, "title"), optionalText(reference, "fileName")));
        }
        for (JsonNode result : root.path("results")) {
            builder.result(readResult(p, result, id));
        }
        return builder.build();
    }

    private ResultDescriptor readResult(JsonParser p, JsonNode node, String metricId) throws IOException {
        String id = requireText(p, node, "id", "Result of metric '" + metricId + "'");
        String where = "Result '" + id + "' of metric '" + metricId + "'";
        int index = requireInt(p, node, "index", where);
        ValueType type;
        try {
            type = ValueType.fromCode(requireText(p, node, "type", where));
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(p, where + ": " + e.getMessage(), e);
        }

        List<ScoreBand> bands = new ArrayList<>();
        for (JsonNode band : node.path("scores")) {
            bands.add(readBand(p, band, where));
        }
        return new ResultDescriptor(
                id,
                index,
                type,
                requireText(p, node, "name", where),
                optionalText(node, "description"),
                bands);
    }

    private static int requireInt(JsonParser p, JsonNode node, String field, String where)
            throws JsonMappingException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw JsonMappingException.from(p, where + " is missing field '" + field + "'");
        }
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw JsonMappingException.from(p, where + " field '" + field + "' must be an integer, got " + value);
        }
        return value.intValue();
    }

    private ScoreBand readBand(JsonParser p, JsonNode node, String result) throws IOException {
        String id = requireText(p, node, "id", "Band of " + result);
        String where = "Band '" + id + "' of " + result;
        return new ScoreBand(
                id,
                readRange(p, node.get("range"), where),
                node.path("judgment").asText(""),
                node.path("description").asText(""),
                readIcon(node.get("icon")));
    }

    private ScoreRange readRange(JsonParser p, JsonNode range, String where) throws IOException {
        if (range == null || range.isNull()) {
            return ScoreRange.UNBOUNDED;
        }
        if (!range.isArray() || range.size() != 2) {
            throw JsonMappingException.from(p, where + " range must be [min, max]");
        }
        return new ScoreRange(readBound(p, range.get(0), where), readBound(p, range.get(1), where));
    }

    private Double readBound(JsonParser p, JsonNode bound, String where) throws IOException {
        if (bound.isNull()) {
            return null;
        }
        if (!bound.isNumber()) {
            throw JsonMappingException.from(p, where + " range bound must be a number or null, got " + bound);
        }
        return bound.doubleValue();
    }

    private Icon readIcon(JsonNode icon) {
        if (icon == null || !icon.isArray() || icon.size() < 2) {
            return Icon.NONE;
        }
        return new Icon(icon.get(0).textValue(), icon.get(1).textValue());
    }

    private static String requireText(JsonParser p, JsonNode node, String field, String where)
            throws JsonMappingException {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw JsonMappingException.from(p, where + " is missing field '" + field + "'");
        }
        return value.asText();
    }

    // `false` and `null` both mean "no value"
    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
