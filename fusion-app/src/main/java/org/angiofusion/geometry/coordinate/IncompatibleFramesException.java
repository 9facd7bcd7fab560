package org.angiofusion.geometry.coordinate;

/**
 * Thrown when arithmetic is attempted between points expressed in different coordinate systems.
 */
public class IncompatibleFramesException
        extends IllegalArgumentException {

    public IncompatibleFramesException(final CoordinateSystem left,
                                       final CoordinateSystem right) {
        super("cannot combine points in " + left + " with points in " + right +
              ", convert one of them with toCoordinateSystem first");
    }

}
