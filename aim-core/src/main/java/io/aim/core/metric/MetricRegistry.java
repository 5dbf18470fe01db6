package io.aim.core.metric;

import io.aim.core.exception.MetricNotFoundException;
import io.aim.core.metric.model.MetricDescriptor;
import java.util.List;
import java.util.Optional;

/// Read-only catalogue of the metrics known to the engine.
///
/// A registry is validated once when it is built and never changes
/// afterwards, so a single instance can be shared by all sessions without
/// locking.
///
/// ### Contracts
/// - **Invariant**: metric ids are unique
/// - **Invariant**: iteration order is registration order
///
/// @see DefaultMetricRegistry
/// @see MetricRegistryValidator
public interface MetricRegistry {

    /// Looks up a metric by id.
    ///
    /// @param id the metric id, not null
    /// @return the descriptor, never null
    /// @throws MetricNotFoundException if no metric has that id
    MetricDescriptor lookup(String id) throws MetricNotFoundException;

    /// Looks up a metric by id.
    ///
    /// @param id the metric id, not null
    /// @return the descriptor, or empty if unknown
    Optional<MetricDescriptor> find(String id);

    /// Returns the metrics of one category in registration order.
    ///
    /// @param categoryId the category id, not null
    /// @return unmodifiable list, never null (empty for unknown categories)
    List<MetricDescriptor> listByCategory(String categoryId);

    /// Returns all metrics in registration order.
    ///
    /// @return unmodifiable list, never null
    List<MetricDescriptor> all();

    /// Returns the distinct category ids in order of first appearance.
    ///
    /// @return unmodifiable list, never null
    List<String> categories();

    boolean contains(String id);

    int size();

    /// Returns the zero-based registration position of a metric.
    ///
    /// Used as a stable tie-breaker when ordering work.
    ///
    /// @param id the metric id, not null
    /// @return the position, or `-1` if unknown
    int registrationIndex(String id);
}
