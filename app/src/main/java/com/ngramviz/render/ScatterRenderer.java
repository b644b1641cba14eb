package com.ngramviz.render;

import java.io.IOException;
import java.nio.file.Path;

/**
 * External collaborator producing a viewable 3D document from scatter points.
 */
public interface ScatterRenderer {
    
    /**
     * Render {@code plot} to {@code output}.
     * 
     * @throws RendererUnavailableException If the renderer cannot be engaged
     * @throws IOException If writing fails
     */
    void render(ScatterPlot plot, Path output) throws RendererUnavailableException, IOException;
    
    /**
     * File extension of the documents this renderer produces, without the dot.
     */
    String getExtension();
    
    /**
     * Get renderer name.
     */
    String getRendererName();
    
    /**
     * Check if renderer is available.
     */
    boolean isAvailable();
}
