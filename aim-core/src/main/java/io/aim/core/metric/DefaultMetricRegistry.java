package io.aim.core.metric;

import io.aim.core.exception.MetricNotFoundException;
import io.aim.core.exception.RegistryValidationException;
import io.aim.core.metric.model.MetricDescriptor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Immutable in-memory {@link MetricRegistry}.
///
/// Instances are only created through the validating factory methods; once
/// built, all lookups are served from unmodifiable maps and are safe to call
/// from any thread.
///
/// @see MetricRegistryValidator
public final class DefaultMetricRegistry implements MetricRegistry {

    private static final Logger logger = Logger.getLogger(DefaultMetricRegistry.class.getName());

    private final Map<String, MetricDescriptor> metrics;
    private final Map<String, Integer> positions;
    private final Map<String, List<MetricDescriptor>> byCategory;
    private final List<String> categories;

    private DefaultMetricRegistry(List<MetricDescriptor> descriptors) {
        Map<String, MetricDescriptor> ordered = new LinkedHashMap<>();
        Map<String, Integer> index = new HashMap<>();
        Map<String, List<MetricDescriptor>> grouped = new LinkedHashMap<>();
        Set<String> categoryIds = new LinkedHashSet<>();

        for (MetricDescriptor descriptor : descriptors) {
            index.put(descriptor.getId(), ordered.size());
            ordered.put(descriptor.getId(), descriptor);
            categoryIds.add(descriptor.getCategoryId());
            grouped.computeIfAbsent(descriptor.getCategoryId(), k -> new ArrayList<>())
                    .add(descriptor);
        }
        grouped.replaceAll((category, list) -> List.copyOf(list));

        this.metrics = Collections.unmodifiableMap(ordered);
        this.positions = Map.copyOf(index);
        this.byCategory = Collections.unmodifiableMap(grouped);
        this.categories = List.copyOf(categoryIds);
    }

    /// Builds a registry from descriptors in registration order.
    ///
    /// @param descriptors the metrics, not null
    /// @return the validated registry, never null
    /// @throws RegistryValidationException if any structural check fails
    public static DefaultMetricRegistry of(List<MetricDescriptor> descriptors) {
        Objects.requireNonNull(descriptors, "descriptors must not be null");
        return create(descriptors, MetricRegistryValidator.validate(descriptors));
    }

    /// Builds a registry from a document keyed by metric id.
    ///
    /// @param document descriptors by declared key, in document order, not null
    /// @return the validated registry, never null
    /// @throws RegistryValidationException if any structural check fails,
    ///         including a key that differs from the embedded id
    public static DefaultMetricRegistry fromDocument(Map<String, MetricDescriptor> document) {
        Objects.requireNonNull(document, "document must not be null");
        return create(List.copyOf(document.values()), MetricRegistryValidator.validate(document));
    }

    private static DefaultMetricRegistry create(
            List<MetricDescriptor> descriptors, List<String> problems) {
        if (!problems.isEmpty()) {
            throw new RegistryValidationException(problems);
        }
        DefaultMetricRegistry registry = new DefaultMetricRegistry(descriptors);
        logger.info(
                "Loaded metric registry with "
                        + registry.size()
                        + " metrics in categories "
                        + registry.categories);
        return registry;
    }

    @Override
    public MetricDescriptor lookup(String id) throws MetricNotFoundException {
        Objects.requireNonNull(id, "id must not be null");
        MetricDescriptor descriptor = metrics.get(id);
        if (descriptor == null) {
            throw new MetricNotFoundException("Metric not found: " + id);
        }
        return descriptor;
    }

    @Override
    public Optional<MetricDescriptor> find(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return Optional.ofNullable(metrics.get(id));
    }

    @Override
    public List<MetricDescriptor> listByCategory(String categoryId) {
        Objects.requireNonNull(categoryId, "categoryId must not be null");
        return byCategory.getOrDefault(categoryId, List.of());
    }

    @Override
    public List<MetricDescriptor> all() {
        return List.copyOf(metrics.values());
    }

    @Override
    public List<String> categories() {
        return categories;
    }

    @Override
    public boolean contains(String id) {
        return id != null && metrics.containsKey(id);
    }

    @Override
    public int size() {
        return metrics.size();
    }

    @Override
    public int registrationIndex(String id) {
        if (id == null) {
            return -1;
        }
        Integer position = positions.get(id);
        return position != null ? position : -1;
    }
}
