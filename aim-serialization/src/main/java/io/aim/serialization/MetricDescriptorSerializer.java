package io.aim.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.aim.core.metric.model.MetricDescriptor;
import io.aim.core.metric.model.Reference;
import io.aim.core.metric.model.ResultDescriptor;
import io.aim.core.metric.model.ScoreBand;
import java.io.IOException;
import java.io.Serial;

/// Writes a metric in the registry document shape read by {@link MetricDescriptorDeserializer}.
///
/// A missing result description is written as `false`, unbounded range ends
/// and empty icons as `null`.
class MetricDescriptorSerializer extends StdSerializer<MetricDescriptor> {

    @Serial private static final long serialVersionUID = -4617003309285532880L;

    MetricDescriptorSerializer() {
        super(MetricDescriptor.class);
    }

    @Override
    public void serialize(MetricDescriptor metric, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", metric.getId());
        gen.writeStringField("name", metric.getName());
        gen.writeStringField("category", metric.getCategoryId());
        gen.writeStringField("description", metric.getDescription());
        gen.writeNumberField("evidence", metric.getEvidence());
        gen.writeNumberField("relevance", metric.getRelevance());
        gen.writeNumberField("speed", metric.getSpeed().getRating());
        gen.writeStringField("visualizationType", metric.getVisualizationType().getCode());

        gen.writeArrayFieldStart("references");
        for (Reference reference : metric.getReferences()) {
            gen.writeStartObject();
            gen.writeStringField("title", reference.title());
            gen.writeStringField("fileName", reference.fileName());
            gen.writeEndObject();
        }
        gen.writeEndArray();

        gen.writeArrayFieldStart("results");
        for (ResultDescriptor result : metric.getResults()) {
            writeResult(result, gen);
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }

    private void writeResult(ResultDescriptor result, JsonGenerator gen) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", result.id());
        gen.writeNumberField("index", result.index());
        gen.writeStringField("type", result.valueType().getCode());
        gen.writeStringField("name", result.name());
        if (result.description() != null) {
            gen.writeStringField("description", result.description());
        } else {
            gen.writeBooleanField("description", false);
        }
        gen.writeArrayFieldStart("scores");
        for (ScoreBand band : result.bands()) {
            gen.writeStartObject();
            gen.writeStringField("id", band.id());
            gen.writeArrayFieldStart("range");
            writeBound(band.range().min(), gen);
            writeBound(band.range().max(), gen);
            gen.writeEndArray();
            gen.writeStringField("description", band.description());
            gen.writeStringField("judgment", band.judgment());
            gen.writeArrayFieldStart("icon");
            gen.writeString(band.icon().set());
            gen.writeString(band.icon().name());
            gen.writeEndArray();
            gen.writeEndObject();
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }

    private static void writeBound(Double bound, JsonGenerator gen) throws IOException {
        if (bound == null) {
            gen.writeNull();
        } else {
            gen.writeNumber(bound);
        }
    }
}
