package com.ngramviz.render;

import com.ngramviz.core.FrequencyTable;
import com.ngramviz.core.NgramMode;
import com.ngramviz.core.ToneMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Turns a finished frequency table into display grids or scatter points.
 */
public class GridEmitter {
    
    private static final Logger logger = LoggerFactory.getLogger(GridEmitter.class);
    
    public static final int SLICE_COUNT = 256;
    
    // weakest first: lower count, then later index
    private static final Comparator<long[]> WEAKEST_FIRST =
        Comparator.<long[]>comparingLong(entry -> entry[1])
            .thenComparing(Comparator.<long[]>comparingLong(entry -> entry[0]).reversed());
    
    private final ToneMapper toneMapper;
    
    public GridEmitter(ToneMapper toneMapper) {
        this.toneMapper = toneMapper;
    }
    
    public ToneMapper getToneMapper() {
        return toneMapper;
    }
    
    /**
     * 2D heatmap: pixel (x, y) shows the pair (x, y).
     */
    public GrayscaleGrid heatmap(FrequencyTable table, long peak) {
        requireMode(table, NgramMode.PAIR);
        GrayscaleGrid.Builder builder = GrayscaleGrid.builder();
        for (int y = 0; y < GrayscaleGrid.SIZE; y++) {
            for (int x = 0; x < GrayscaleGrid.SIZE; x++) {
                builder.set(x, y, toneMapper.brightness(table.count(x, y), peak));
            }
        }
        return builder.build();
    }
    
    /**
     * Slice {@code z} of the triplet volume: pixel (x, y) shows the triplet (z, x, y).
     */
    public GrayscaleGrid slice(FrequencyTable table, int z, long peak) {
        requireMode(table, NgramMode.TRIPLET);
        if (z < 0 || z >= SLICE_COUNT) {
            throw new IllegalArgumentException("Slice index out of range: " + z);
        }
        GrayscaleGrid.Builder builder = GrayscaleGrid.builder();
        for (int y = 0; y < GrayscaleGrid.SIZE; y++) {
            for (int x = 0; x < GrayscaleGrid.SIZE; x++) {
                builder.set(x, y, toneMapper.brightness(table.count(z, x, y), peak));
            }
        }
        return builder.build();
    }
    
    /**
     * One point per observed triplet. When more than {@code maxPoints} triplets were observed,
     * only the most frequent are kept, ordered by descending count with ties in index order;
     * otherwise points follow index order.
     */
    public ScatterPlot scatter(FrequencyTable table, long peak, int maxPoints) {
        requireMode(table, NgramMode.TRIPLET);
        if (maxPoints <= 0) {
            throw new IllegalArgumentException("Point cap must be positive, got " + maxPoints);
        }
        
        int observed = table.getDistinctCount();
        List<ScatterPoint> points = new ArrayList<>(Math.min(observed, maxPoints));
        
        if (observed <= maxPoints) {
            table.forEachNonZero((index, count) -> points.add(toPoint(index, count, peak)));
        } else {
            PriorityQueue<long[]> strongest = new PriorityQueue<>(maxPoints + 1, WEAKEST_FIRST);
            table.forEachNonZero((index, count) -> {
                strongest.add(new long[] {index, count});
                if (strongest.size() > maxPoints) {
                    strongest.poll();
                }
            });
            
            List<long[]> kept = new ArrayList<>(strongest);
            kept.sort(WEAKEST_FIRST.reversed());
            for (long[] entry : kept) {
                points.add(toPoint((int) entry[0], entry[1], peak));
            }
            logger.info("Scatter limited to the {} most frequent of {} triplets", maxPoints, observed);
        }
        
        return new ScatterPlot(points, peak, toneMapper.getCurve().getLabel(), observed);
    }
    
    private ScatterPoint toPoint(int index, long count, long peak) {
        int brightness = toneMapper.brightness(count, peak);
        return new ScatterPoint(index >>> 16, (index >>> 8) & 0xFF, index & 0xFF,
            count, brightness, ToneMapper.opacity(brightness));
    }
    
    private static void requireMode(FrequencyTable table, NgramMode expected) {
        if (table.getMode() != expected) {
            throw new IllegalArgumentException("Expected a " + expected.getLabel()
                + " table, got " + table.getMode().getLabel());
        }
    }
}
