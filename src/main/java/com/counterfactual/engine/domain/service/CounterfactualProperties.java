package com.counterfactual.engine.domain.service;

import com.counterfactual.engine.domain.service.forecast.NoiseMode;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "counterfactual")
public class CounterfactualProperties {

    private String timeCol;
    private String targetCol;
    private String entityCol;
    private boolean autoDetect = true;
    private int detectionSampleSize = 20;

    private int arOrder = 1;
    private String cyclePeriod = "auto";
    private int forecastDays = 5;
    private Double minValue;
    private Double maxValue;
    private double noiseFactor = 0.5;
    private NoiseMode noiseMode = NoiseMode.SEEDED;
    private long noiseSeed = 0L;

    private String outputPrefix = "counterfactual";
    private String zone = "UTC";
    private int parallelism = 1;
}
