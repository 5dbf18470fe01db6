package io.aim.core.classify;

import io.aim.core.metric.model.ScoreBand;
import java.util.List;
import java.util.Optional;

/// First-match classifier: the first band, in declared order, whose inclusive
/// range contains the value decides the judgment.
///
/// Values falling between bands (for example `0.105` with bands ending at
/// `0.10` and starting at `0.11`) receive no judgment. Classification always
/// uses the raw value, never a rounded presentation of it.
public class ScoreBandClassifier implements ResultClassifier {

    @Override
    public Optional<Judgment> classify(double value, List<ScoreBand> bands) {
        for (ScoreBand band : bands) {
            if (band.matches(value)) {
                return Optional.of(Judgment.of(band));
            }
        }
        return Optional.empty();
    }
}
