package io.aim.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.aim.core.evaluator.ResultValue;
import io.aim.core.metric.model.MetricDescriptor;
import io.aim.core.session.EvaluationEvent;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all AIM serialization handlers in one place.
///
/// - `MetricDescriptor`: {@link MetricDescriptorSerializer} / {@link MetricDescriptorDeserializer},
///   the registry document shape
/// - `EvaluationEvent`: {@link EvaluationEventSerializer}, outbound only
/// - `ResultValue`: {@link ResultValueSerializer}, a bare number or base64 string
///
/// @implNote All registrations are explicit; no classpath scanning, no reflection
/// on domain types.
/// @see AimSerializer for the convenience factory API
public class AimJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 6458912006387741520L;

    public AimJacksonModule() {
        super("AimJacksonModule");

        addSerializer(MetricDescriptor.class, new MetricDescriptorSerializer());
        addDeserializer(MetricDescriptor.class, new MetricDescriptorDeserializer());

        addSerializer(EvaluationEvent.class, new EvaluationEventSerializer());
        addSerializer(ResultValue.class, new ResultValueSerializer());
    }
}
