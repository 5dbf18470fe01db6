package io.aim.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.aim.core.exception.RegistryValidationException;
import io.aim.core.metric.DefaultMetricRegistry;
import io.aim.core.metric.model.MetricDescriptor;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Objects;
import java.util.logging.Logger;

/// Loads a metric registry from a JSON document keyed by metric id.
///
/// ### Document shape
/// {@snippet lang=json :
/// {
///   "m1": {
///     "id": "m1", "name": "PNG File Size", "category": "cp",
///     "evidence": 1, "relevance": 2, "speed": 2, "visualizationType": "table",
///     "results": [{
///       "id": "m1_0", "index": 0, "type": "int", "name": "PNG File Size (in bytes)",
///       "description": false,
///       "scores": [{"id": "r1", "range": [0, 500000], "description": "Suitable",
///                   "judgment": "good", "icon": ["far", "check-circle"]}]
///     }]
///   }
/// }
/// }
///
/// Duplicate keys and malformed entries are rejected while parsing; the
/// structural checks of {@link DefaultMetricRegistry#fromDocument} run on the
/// parsed document. Both surface as {@link RegistryValidationException}.
public final class MetricRegistryLoader {

    private static final Logger logger = Logger.getLogger(MetricRegistryLoader.class.getName());

    /// Classpath location of the registry shipped with the built-in metrics.
    public static final String DEFAULT_REGISTRY_RESOURCE = "aim/metrics.json";

    private static final TypeReference<LinkedHashMap<String, MetricDescriptor>> DOCUMENT =
            new TypeReference<>() {};

    private static final ObjectMapper MAPPER =
            AimSerializer.createMapper().enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);

    private MetricRegistryLoader() {}

    /// Loads a registry file.
    ///
    /// @param path the document, not null
    /// @return the validated registry, never null
    /// @throws IOException if the file cannot be read
    /// @throws RegistryValidationException if the document is malformed or invalid
    public static DefaultMetricRegistry load(Path path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        logger.info("Loading metric registry from " + path);
        try (InputStream in = Files.newInputStream(path)) {
            return fromJson(in);
        }
    }

    /// Loads a registry from the classpath.
    ///
    /// @param resource resource name, e.g. {@link #DEFAULT_REGISTRY_RESOURCE}, not null
    /// @return the validated registry, never null
    /// @throws IllegalArgumentException if the resource does not exist
    /// @throws UncheckedIOException if the resource cannot be read
    /// @throws RegistryValidationException if the document is malformed or invalid
    public static DefaultMetricRegistry loadResource(String resource) {
        Objects.requireNonNull(resource, "resource must not be null");
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = MetricRegistryLoader.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Metric registry resource not found: " + resource);
            }
            logger.info("Loading metric registry from classpath:" + resource);
            return fromJson(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read metric registry resource " + resource, e);
        }
    }

    /// Loads the registry shipped with the built-in metrics.
    ///
    /// @return the validated registry, never null
    public static DefaultMetricRegistry loadDefault() {
        return loadResource(DEFAULT_REGISTRY_RESOURCE);
    }

    /// Parses a registry document.
    ///
    /// @param json document text, not null
    /// @return the validated registry, never null
    /// @throws RegistryValidationException if the document is malformed or invalid
    public static DefaultMetricRegistry fromJson(String json) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            return DefaultMetricRegistry.fromDocument(MAPPER.readValue(json, DOCUMENT));
        } catch (JsonProcessingException e) {
            throw malformed(e);
        }
    }

    /// Parses a registry document from a stream.
    ///
    /// @param in document bytes (UTF-8), not null
    /// @return the validated registry, never null
    /// @throws IOException if the stream cannot be read
    /// @throws RegistryValidationException if the document is malformed or invalid
    public static DefaultMetricRegistry fromJson(InputStream in) throws IOException {
        Objects.requireNonNull(in, "in must not be null");
        try {
            return DefaultMetricRegistry.fromDocument(MAPPER.readValue(in, DOCUMENT));
        } catch (JsonProcessingException e) {
            throw malformed(e);
        }
    }

    private static RegistryValidationException malformed(JsonProcessingException e) {
        return new RegistryValidationException("Malformed document: " + e.getOriginalMessage(), e);
    }
}
