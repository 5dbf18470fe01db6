package io.aim.core.metric;

import io.aim.core.metric.model.MetricDescriptor;
import io.aim.core.metric.model.ResultDescriptor;
import io.aim.core.metric.model.ScoreBand;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Structural checks applied to metric definitions before they enter a registry.
///
/// Every check runs to completion and contributes to one list of problems,
/// so a document with several mistakes is reported in full.
///
/// ### Checks
/// - metric ids are unique and match the document key they were declared under
/// - `evidence` and `relevance` are within `1..5`
/// - each metric declares at least one result
/// - result indices are exactly `0..N-1`, result ids are unique per metric
/// - band ranges have `min <= max` and band ids are unique per result
/// - no band is shadowed by an earlier band whose range covers it entirely
public final class MetricRegistryValidator {

    static final int MIN_RATING = 1;
    static final int MAX_RATING = 5;

    private MetricRegistryValidator() {}

    /// Validates a document keyed by metric id.
    ///
    /// @param document metric descriptors by document key, not null
    /// @return problems found, empty if the document is valid
    public static List<String> validate(Map<String, MetricDescriptor> document) {
        List<String> problems = new ArrayList<>();
        for (Map.Entry<String, MetricDescriptor> entry : document.entrySet()) {
            String declaredId = entry.getValue().getId();
            if (!entry.getKey().equals(declaredId)) {
                problems.add(
                        "Metric declared under key '"
                                + entry.getKey()
                                + "' has id '"
                                + declaredId
                                + "'");
            }
        }
        problems.addAll(validate(List.copyOf(document.values())));
        return problems;
    }

    /// Validates a list of metric descriptors.
    ///
    /// @param metrics descriptors in registration order, not null
    /// @return problems found, empty if the metrics are valid
    public static List<String> validate(List<MetricDescriptor> metrics) {
        List<String> problems = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (MetricDescriptor metric : metrics) {
            if (metric.getId().isBlank()) {
                problems.add("Metric id must not be blank");
            } else if (!seen.add(metric.getId())) {
                problems.add("Duplicate metric id '" + metric.getId() + "'");
            }
            validateMetric(metric, problems);
        }
        return problems;
    }

    private static void validateMetric(MetricDescriptor metric, List<String> problems) {
        String id = metric.getId();
        checkRating(id, "evidence", metric.getEvidence(), problems);
        checkRating(id, "relevance", metric.getRelevance(), problems);

        List<ResultDescriptor> results = metric.getResults();
        if (results.isEmpty()) {
            problems.add("Metric '" + id + "' declares no results");
            return;
        }

        Set<Integer> indices = new HashSet<>();
        Set<String> resultIds = new HashSet<>();
        for (ResultDescriptor result : results) {
            if (!indices.add(result.index())) {
                problems.add(
                        "Metric '" + id + "' declares result index " + result.index() + " twice");
            }
            if (!resultIds.add(result.id())) {
                problems.add("Metric '" + id + "' declares result id '" + result.id() + "' twice");
            }
            validateBands(id, result, problems);
        }
        for (int expected = 0; expected < results.size(); expected++) {
            if (!indices.contains(expected)) {
                problems.add(
                        "Metric '"
                                + id
                                + "' result indices must be contiguous from 0, missing "
                                + expected);
            }
        }
    }

    private static void validateBands(
            String metricId, ResultDescriptor result, List<String> problems) {
        List<ScoreBand> bands = result.bands();
        Set<String> bandIds = new HashSet<>();
        for (int i = 0; i < bands.size(); i++) {
            ScoreBand band = bands.get(i);
            String where = "Band '" + band.id() + "' of " + metricId + "/" + result.id();
            if (!bandIds.add(band.id())) {
                problems.add(where + " is declared twice");
            }
            if (band.range().isInverted()) {
                problems.add(where + " has min greater than max " + band.range());
                continue;
            }
            for (int j = 0; j < i; j++) {
                ScoreBand earlier = bands.get(j);
                if (!earlier.range().isInverted() && earlier.range().covers(band.range())) {
                    problems.add(
                            where
                                    + " is unreachable, shadowed by earlier band '"
                                    + earlier.id()
                                    + "' "
                                    + earlier.range());
                    break;
                }
            }
        }
    }

    private static void checkRating(String metricId, String field, int value, List<String> problems) {
        if (value < MIN_RATING || value > MAX_RATING) {
            problems.add(
                    "Metric '"
                            + metricId
                            + "' "
                            + field
                            + " must be between "
                            + MIN_RATING
                            + " and "
                            + MAX_RATING
                            + ", got "
                            + value);
        }
    }
}
