package com.ngramviz.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders scatter points into a standalone HTML page with an interactive plotly.js 3D view.
 * <p>
 * The page skeleton is a classpath template containing a {@value #PAYLOAD_PLACEHOLDER}
 * marker, which is replaced by the points serialized as JSON. Without the template the
 * renderer is unavailable.
 */
public class HtmlScatterRenderer implements ScatterRenderer {
    
    private static final Logger logger = LoggerFactory.getLogger(HtmlScatterRenderer.class);
    
    public static final String PAYLOAD_PLACEHOLDER = "{{PAYLOAD}}";
    
    private final String templateResource;
    private final ObjectMapper objectMapper;
    
    public HtmlScatterRenderer(String templateResource) {
        this(templateResource, new ObjectMapper());
    }
    
    public HtmlScatterRenderer(String templateResource, ObjectMapper objectMapper) {
        this.templateResource = templateResource;
        this.objectMapper = objectMapper;
    }
    
    @Override
    public void render(ScatterPlot plot, Path output) throws RendererUnavailableException, IOException {
        String template = loadTemplate();
        String payload = toJson(plot);
        
        int marker = template.indexOf(PAYLOAD_PLACEHOLDER);
        String page = template.substring(0, marker) + payload
            + template.substring(marker + PAYLOAD_PLACEHOLDER.length());
        
        StagedOutput.write(output, StandardCharsets.UTF_8, writer -> writer.write(page));
        logger.info("Wrote {} scatter points to {}", plot.getPoints().size(), output);
    }
    
    /**
     * Column-oriented JSON document of the plot, safe to embed in a script element.
     */
    String toJson(ScatterPlot plot) throws JsonProcessingException {
        List<ScatterPoint> points = plot.getPoints();
        int size = points.size();
        int[] xs = new int[size];
        int[] ys = new int[size];
        int[] zs = new int[size];
        long[] counts = new long[size];
        int[] brightness = new int[size];
        double[] opacity = new double[size];
        
        for (int i = 0; i < size; i++) {
            ScatterPoint point = points.get(i);
            xs[i] = point.getX();
            ys[i] = point.getY();
            zs[i] = point.getZ();
            counts[i] = point.getCount();
            brightness[i] = point.getBrightness();
            opacity[i] = point.getOpacity();
        }
        
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("title", plot.getTitle());
        document.put("scale", plot.getCurveLabel());
        document.put("peak", plot.getPeak());
        document.put("observed", plot.getObservedCount());
        document.put("x", xs);
        document.put("y", ys);
        document.put("z", zs);
        document.put("count", counts);
        document.put("brightness", brightness);
        document.put("opacity", opacity);
        
        return objectMapper.writeValueAsString(document).replace("</", "<\\/");
    }
    
    private String loadTemplate() throws RendererUnavailableException {
        try (InputStream in = openTemplate()) {
            if (in == null) {
                throw new RendererUnavailableException(
                    "Scatter template not found on classpath: " + templateResource);
            }
            String template = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            if (!template.contains(PAYLOAD_PLACEHOLDER)) {
                throw new RendererUnavailableException(
                    "Scatter template " + templateResource + " has no " + PAYLOAD_PLACEHOLDER + " marker");
            }
            return template;
        } catch (IOException e) {
            throw new RendererUnavailableException("Failed to load scatter template " + templateResource, e);
        }
    }
    
    private InputStream openTemplate() {
        return HtmlScatterRenderer.class.getClassLoader().getResourceAsStream(templateResource);
    }
    
    @Override
    public String getExtension() {
        return "html";
    }
    
    @Override
    public String getRendererName() {
        return "HTML (plotly.js)";
    }
    
    @Override
    public boolean isAvailable() {
        try {
            loadTemplate();
            return true;
        } catch (RendererUnavailableException e) {
            logger.warn("Scatter renderer unavailable: {}", e.getMessage());
            return false;
        }
    }
}
