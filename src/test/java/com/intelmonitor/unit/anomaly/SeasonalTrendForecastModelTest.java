package com.intelmonitor.unit.anomaly;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.intelmonitor.anomaly.Forecast;
import com.intelmonitor.anomaly.SeasonalTrendForecastModel;
import com.intelmonitor.domain.model.TimeSeriesPoint;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SeasonalTrendForecastModelTest {

    private static final LocalDateTime ORIGIN = LocalDateTime.of(2025, 1, 1, 0, 0);

    @Test
    @DisplayName("Flat then rising series keeps the hinge changepoint and extrapolates the final slope")
    void kinkedSeriesUsesChangepoint() {
        List<TimeSeriesPoint> points = new ArrayList<>();
        for (int d = 0; d < 30; d++) {
            double value = d < 15 ? 100.0 : 100.0 + 10.0 * (d - 15);
            points.add(new TimeSeriesPoint(ORIGIN.plusDays(d), value));
        }
        SeasonalTrendForecastModel model = new SeasonalTrendForecastModel(7);

        model.fit(points);

        assertThat(model.hasChangepoint()).isTrue();
        Forecast forecast = model.predict(ORIGIN.plusDays(40), 0.8);
        assertThat(forecast.trend()).isCloseTo(350.0, within(1e-6));
    }

    @Test
    @DisplayName("Degenerate changepoint candidates are skipped instead of failing the fit")
    void singularDesignSkipped() {
        List<TimeSeriesPoint> points = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            points.add(new TimeSeriesPoint(ORIGIN, i % 2 == 0 ? 100.0 : 102.0));
        }
        SeasonalTrendForecastModel model = new SeasonalTrendForecastModel(7);

        model.fit(points);

        assertThat(model.hasChangepoint()).isFalse();
        Forecast forecast = model.predict(ORIGIN, 0.8);
        assertThat(forecast.yhat()).isEqualTo(100.0);
        assertThat(forecast.lower()).isLessThan(forecast.upper());
    }

    @Test
    @DisplayName("Predicting before fitting is rejected")
    void predictBeforeFit() {
        assertThatThrownBy(() -> new SeasonalTrendForecastModel(7).predict(ORIGIN, 0.8))
                .isInstanceOf(IllegalStateException.class);
    }
}
