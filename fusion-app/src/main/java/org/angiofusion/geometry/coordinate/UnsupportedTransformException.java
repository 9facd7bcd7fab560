package org.angiofusion.geometry.coordinate;

/**
 * Thrown when no transform is defined between a pair of coordinate systems or patient positions.
 */
public class UnsupportedTransformException
        extends IllegalArgumentException {

    public UnsupportedTransformException(final Object from,
                                         final Object to) {
        super("no direct transformation from " + from + " to " + to);
    }

}
