package org.expbench.engine.assembly;

/**
 * Raised when an experiment/metric feature combination has no compilation rule
 * for a given approach or variant. Fatal for that combination only.
 */
public class RenderException extends RuntimeException {

    public RenderException(String message) {
        super(message);
    }
}
