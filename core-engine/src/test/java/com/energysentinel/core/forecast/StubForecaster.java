package com.energysentinel.core.forecast;

import com.energysentinel.core.model.ForecasterKind;

import java.time.LocalDateTime;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Fitted forecaster whose predictions come from a function of the hour.
 */
final class StubForecaster implements FittedForecaster {

    private final ForecasterKind kind;
    private final LocalDateTime trainingStart;
    private final LocalDateTime trainingEnd;
    private final double residualStdDev;
    private final ToDoubleFunction<LocalDateTime> prediction;

    StubForecaster(ForecasterKind kind, LocalDateTime trainingStart, LocalDateTime trainingEnd,
            double residualStdDev, ToDoubleFunction<LocalDateTime> prediction) {
        this.kind = kind;
        this.trainingStart = trainingStart;
        this.trainingEnd = trainingEnd;
        this.residualStdDev = residualStdDev;
        this.prediction = prediction;
    }

    static StubForecaster constant(ForecasterKind kind, LocalDateTime start, LocalDateTime end, double value) {
        return new StubForecaster(kind, start, end, 0.1, hour -> value);
    }

    @Override
    public ForecasterKind getKind() {
        return kind;
    }

    @Override
    public LocalDateTime getTrainingStart() {
        return trainingStart;
    }

    @Override
    public LocalDateTime getTrainingEnd() {
        return trainingEnd;
    }

    @Override
    public double getResidualStdDev() {
        return residualStdDev;
    }

    @Override
    public double[] predictAt(List<LocalDateTime> hours) {
        double[] out = new double[hours.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = prediction.applyAsDouble(hours.get(i));
        }
        return out;
    }
}
