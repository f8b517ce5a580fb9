package org.nowstart.retune.service.signal;

import org.nowstart.retune.data.dto.BacktestWindow;
import org.nowstart.retune.data.dto.ForecastMetrics;
import org.nowstart.retune.data.dto.Hyperparameters;

/**
 * Scores one hyperparameter set on a backtest window. Implementations may block for the duration of
 * the backtest and may throw on any upstream failure.
 */
public interface ForecastEvaluator {

    ForecastMetrics evaluate(Hyperparameters hyperparameters, BacktestWindow window);
}
