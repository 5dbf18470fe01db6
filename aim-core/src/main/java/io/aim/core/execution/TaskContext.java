package io.aim.core.execution;

import io.aim.core.classify.ResultClassifier;
import java.time.Duration;
import java.util.concurrent.ExecutorService;

/// Collaborators shared by every task of a dispatcher.
///
/// @param evaluatorPool unbounded pool running evaluator calls, so that a
///        timed-out call can keep running without holding a worker
/// @param timeout longest time a worker waits for one evaluator
/// @param classifier maps numeric values to judgments
/// @param listener lifecycle callbacks
record TaskContext(
        ExecutorService evaluatorPool,
        Duration timeout,
        ResultClassifier classifier,
        EvaluationListener listener) {}
