package org.angiofusion.geometry.util;

/**
 * Thrown when a computation would otherwise produce a meaningless (NaN or infinite) result,
 * for example when inverting a singular matrix or normalizing a zero length vector.
 */
public class DegenerateGeometryException
        extends IllegalArgumentException {

    public DegenerateGeometryException(final String message) {
        super(message);
    }

}
