package io.aim.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.aim.core.metric.MetricRegistry;
import io.aim.core.metric.model.MetricDescriptor;
import io.aim.core.session.EvaluationEvent;
import java.util.LinkedHashMap;
import java.util.Map;

/// Utility class for writing AIM events and registries as JSON.
///
/// ### Usage
/// {@snippet :
/// // One event, as pushed to a client
/// String json = AimSerializer.toJson(event);
///
/// // The whole registry, in document shape
/// String catalogue = AimSerializer.toJson(registry);
/// }
///
/// @implNote Thread-safe. Writers share one mapper; use {@link #createMapper()}
/// for a private, reconfigurable instance.
///
/// @see AimJacksonModule for the registered type handlers
/// @see MetricRegistryLoader for reading registry documents
public final class AimSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private AimSerializer() {}

    /// Serializes one event to compact JSON.
    ///
    /// @param event the event, not null
    /// @return JSON object text, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(EvaluationEvent event) {
        try {
            return MAPPER.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event: " + e.getMessage(), e);
        }
    }

    /// Serializes a registry as a document keyed by metric id, in registration order.
    ///
    /// The output can be read back with {@link MetricRegistryLoader#fromJson(String)}.
    ///
    /// @param registry the registry, not null
    /// @return JSON object text, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(MetricRegistry registry) {
        Map<String, MetricDescriptor> document = new LinkedHashMap<>();
        for (MetricDescriptor metric : registry.all()) {
            document.put(metric.getId(), metric);
        }
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize registry: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for AIM types.
    ///
    /// Registers:
    /// - `AimJacksonModule` for metrics, events and result values
    /// - `JavaTimeModule` for event timestamps
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps written as ISO-8601 strings (not numeric)
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new AimJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
