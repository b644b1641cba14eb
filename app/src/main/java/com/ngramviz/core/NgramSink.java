package com.ngramviz.core;

/**
 * Receives n-grams emitted by {@link NgramCounter}, identified by flattened index.
 */
@FunctionalInterface
public interface NgramSink {
    
    void accept(int index);
}
