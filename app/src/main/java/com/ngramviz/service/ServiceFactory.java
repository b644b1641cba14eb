package com.ngramviz.service;

import com.ngramviz.config.AppConfig;
import com.ngramviz.render.HtmlScatterRenderer;
import com.ngramviz.render.ScatterRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for creating services based on configuration.
 */
public class ServiceFactory {
    
    private static final Logger logger = LoggerFactory.getLogger(ServiceFactory.class);
    
    /**
     * Create frequency service based on configuration.
     */
    public static FrequencyService createFrequencyService(AppConfig config) {
        ChunkedFrequencyService service = new ChunkedFrequencyService(
            config.getScanStrategy(), config.getChunkSizeBytes());
        logger.debug("Using frequency service: {}", service.getServiceName());
        return service;
    }
    
    /**
     * Create the scatter renderer named by configuration. Availability is checked by the caller.
     */
    public static ScatterRenderer createScatterRenderer(AppConfig config) {
        return new HtmlScatterRenderer(config.getScatterTemplate());
    }
    
    /**
     * Create the full pipeline.
     */
    public static VisualizationService createVisualizationService(AppConfig config) {
        return new VisualizationService(
            createFrequencyService(config),
            config.createToneMapper(),
            createScatterRenderer(config),
            config.getVolumeOutput(),
            config.getMaxScatterPoints());
    }
}
