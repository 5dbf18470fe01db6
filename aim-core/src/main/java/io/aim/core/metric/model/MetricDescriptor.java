package io.aim.core.metric.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// Immutable definition of one metric in the registry.
///
/// Describes what a metric measures, how trustworthy and relevant it is,
/// how expensive it is to compute and which values it produces. The actual
/// computation is supplied separately by a
/// {@link io.aim.core.evaluator.MetricEvaluator} registered under the same id.
///
/// Structural rules spanning several fields (contiguous result indices,
/// non-shadowed bands, rating ranges) are checked when the descriptor is
/// loaded into a registry, so that all problems are reported together.
///
/// @implNote Immutable and thread-safe after construction.
///
/// @see io.aim.core.metric.MetricRegistryValidator
public final class MetricDescriptor {

    private final String id;
    private final String categoryId;
    private final String name;
    private final String description;
    private final int evidence;
    private final int relevance;
    private final Speed speed;
    private final VisualizationType visualizationType;
    private final List<Reference> references;
    private final List<ResultDescriptor> results;

    private MetricDescriptor(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Metric ID required");
        this.categoryId = Objects.requireNonNull(builder.categoryId, "Category required");
        this.name = Objects.requireNonNull(builder.name, "Name required");
        this.description = builder.description;
        this.evidence = builder.evidence;
        this.relevance = builder.relevance;
        this.speed = Objects.requireNonNull(builder.speed, "Speed required");
        this.visualizationType = builder.visualizationType;
        this.references = Collections.unmodifiableList(new ArrayList<>(builder.references));
        this.results = Collections.unmodifiableList(new ArrayList<>(builder.results));
    }

    public String getId() {
        return id;
    }

    public String getCategoryId() {
        return categoryId;
    }

    public String getName() {
        return name;
    }

    /// @return the description, may be null
    public String getDescription() {
        return description;
    }

    /// Returns the strength of scientific evidence behind the metric.
    ///
    /// @return rating from 1 (weak) to 5 (strong)
    public int getEvidence() {
        return evidence;
    }

    /// Returns how relevant the metric is for graphical user interfaces.
    ///
    /// @return rating from 1 (low) to 5 (high)
    public int getRelevance() {
        return relevance;
    }

    public Speed getSpeed() {
        return speed;
    }

    public VisualizationType getVisualizationType() {
        return visualizationType;
    }

    /// @return unmodifiable list of references, never null
    public List<Reference> getReferences() {
        return references;
    }

    /// Returns the declared results in document order.
    ///
    /// @return unmodifiable list of result descriptors, never null
    public List<ResultDescriptor> getResults() {
        return results;
    }

    /// Returns the results sorted by declared index.
    ///
    /// @return a new list ordered by {@link ResultDescriptor#index()}, never null
    public List<ResultDescriptor> getResultsByIndex() {
        List<ResultDescriptor> sorted = new ArrayList<>(results);
        sorted.sort((a, b) -> Integer.compare(a.index(), b.index()));
        return sorted;
    }

    /// Returns the number of values the metric's evaluator must produce.
    ///
    /// @return number of declared results
    public int getResultCount() {
        return results.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MetricDescriptor that)) return false;
        return evidence == that.evidence
                && relevance == that.relevance
                && id.equals(that.id)
                && categoryId.equals(that.categoryId)
                && name.equals(that.name)
                && Objects.equals(description, that.description)
                && speed == that.speed
                && visualizationType == that.visualizationType
                && references.equals(that.references)
                && results.equals(that.results);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, categoryId, name, speed, results);
    }

    @Override
    public String toString() {
        return "MetricDescriptor{id='" + id + "', category='" + categoryId + "', results="
                + results.size() + "}";
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for constructing immutable metric descriptors.
    ///
    /// Required fields: `id`, `categoryId`, `name`. Speed defaults to
    /// {@link Speed#FAST}, visualization to {@link VisualizationType#TABLE},
    /// evidence and relevance to `1`.
    public static final class Builder {
        private String id;
        private String categoryId;
        private String name;
        private String description;
        private int evidence = 1;
        private int relevance = 1;
        private Speed speed = Speed.FAST;
        private VisualizationType visualizationType = VisualizationType.TABLE;
        private final List<Reference> references = new ArrayList<>();
        private final List<ResultDescriptor> results = new ArrayList<>();

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder categoryId(String categoryId) {
            this.categoryId = categoryId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder evidence(int evidence) {
            this.evidence = evidence;
            return this;
        }

        public Builder relevance(int relevance) {
            this.relevance = relevance;
            return this;
        }

        public Builder speed(Speed speed) {
            this.speed = speed;
            return this;
        }

        public Builder visualizationType(VisualizationType visualizationType) {
            this.visualizationType = visualizationType;
            return this;
        }

        public Builder reference(Reference reference) {
            this.references.add(reference);
            return this;
        }

        public Builder references(List<Reference> references) {
            this.references.addAll(references);
            return this;
        }

        /// Appends a result declaration.
        ///
        /// @param result the result descriptor, not null
        /// @return this builder for chaining
        public Builder result(ResultDescriptor result) {
            this.results.add(Objects.requireNonNull(result, "result must not be null"));
            return this;
        }

        public Builder results(List<ResultDescriptor> results) {
            results.forEach(this::result);
            return this;
        }

        /// Builds the immutable descriptor.
        ///
        /// @return new descriptor, never null
        /// @throws NullPointerException if a required field is missing
        public MetricDescriptor build() {
            return new MetricDescriptor(this);
        }
    }
}
