package com.demandplanner.forecast;

import com.demandplanner.domain.WeeklySeries;
import com.demandplanner.forecast.arima.ArimaModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class SeasonalModelAdapter {

    public ModelForecast forecast(WeeklySeries series, int steps, SeasonalModelConfig config) {
        SeasonalModelConfig effective = config;
        if (config.isSeasonal() && series.size() < ArimaModel.minimumLength(config)) {
            effective = config.withoutSeasonal();
            log.debug("Seasonal term dropped | config={} | weeks={} | required={}",
                config.name(), series.size(), ArimaModel.minimumLength(config));
        }

        try {
            ArimaModel model = ArimaModel.fit(series.values(), effective);
            return model.forecast(steps);
        } catch (ModelFitException ex) {
            log.debug("Seasonal model unavailable | config={} | weeks={} | reason={}",
                effective.name(), series.size(), ex.getMessage());
            return ModelForecast.unavailable(ex.getMessage());
        }
    }
}
