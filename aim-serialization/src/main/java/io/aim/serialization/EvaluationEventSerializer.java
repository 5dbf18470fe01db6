package io.aim.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.aim.core.classify.Judgment;
import io.aim.core.classify.ResultEntry;
import io.aim.core.classify.ValueFormatter;
import io.aim.core.evaluator.ResultValue;
import io.aim.core.session.EvaluationEvent;
import java.io.IOException;
import java.io.Serial;

/// Serializes the `EvaluationEvent` sealed hierarchy for the client channel.
///
/// Every event carries `type`, `action`, `sessionId` and `timestamp`. Per subtype:
/// - **`MetricResult`**: `metric`, `results: [{resultId, index, value, display, judgment}]`,
///   plus `failure: {kind, message}` when the metric failed
/// - **`ValidationError`** / **`GeneralError`**: `message`
/// - **`SessionComplete`**: nothing else
///
/// `judgment` is `null` for unclassified values (images, values outside every band).
/// `display` is the value as shown to users (see {@link ValueFormatter}) and is
/// omitted for images.
class EvaluationEventSerializer extends StdSerializer<EvaluationEvent> {

    @Serial private static final long serialVersionUID = 1893054120734917261L;

    EvaluationEventSerializer() {
        super(EvaluationEvent.class);
    }

    @Override
    public void serialize(EvaluationEvent event, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("type", event.type());
        gen.writeStringField("action", event.action());
        gen.writeStringField("sessionId", event.sessionId());
        provider.defaultSerializeField("timestamp", event.timestamp(), gen);

        if (event instanceof EvaluationEvent.MetricResult result) {
            writeResult(result, gen, provider);
        } else if (event instanceof EvaluationEvent.ValidationError error) {
            gen.writeStringField("message", error.message());
        } else if (event instanceof EvaluationEvent.GeneralError error) {
            gen.writeStringField("message", error.message());
        }

        gen.writeEndObject();
    }

    private void writeResult(
            EvaluationEvent.MetricResult result, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStringField("metric", result.metricId());
        gen.writeArrayFieldStart("results");
        for (ResultEntry entry : result.results()) {
            gen.writeStartObject();
            gen.writeStringField("resultId", entry.resultId());
            gen.writeNumberField("index", entry.index());
            provider.defaultSerializeField("value", entry.value(), gen);
            if (!(entry.value() instanceof ResultValue.ImageValue)) {
                gen.writeStringField("display", ValueFormatter.format(entry.value()));
            }
            writeJudgment(entry.judgment(), gen);
            gen.writeEndObject();
        }
        gen.writeEndArray();

        if (result.isFailure()) {
            gen.writeObjectFieldStart("failure");
            gen.writeStringField("kind", result.failureKind().name());
            gen.writeStringField("message", result.failureMessage());
            gen.writeEndObject();
        }
    }

    private void writeJudgment(Judgment judgment, JsonGenerator gen) throws IOException {
        if (judgment == null) {
            gen.writeNullField("judgment");
            return;
        }
        gen.writeObjectFieldStart("judgment");
        gen.writeStringField("id", judgment.bandId());
        gen.writeStringField("label", judgment.label());
        gen.writeStringField("description", judgment.description());
        gen.writeArrayFieldStart("icon");
        gen.writeString(judgment.icon().set());
        gen.writeString(judgment.icon().name());
        gen.writeEndArray();
        gen.writeEndObject();
    }
}
