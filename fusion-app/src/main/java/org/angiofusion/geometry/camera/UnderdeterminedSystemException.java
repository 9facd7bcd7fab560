package org.angiofusion.geometry.camera;

/**
 * Thrown when triangulation is attempted with too few views to determine a point.
 */
public class UnderdeterminedSystemException
        extends IllegalArgumentException {

    public UnderdeterminedSystemException(final int numberOfViews) {
        super("triangulation requires at least " + PinholeCamera.MIN_TRIANGULATION_VIEWS +
              " views but only " + numberOfViews + " were provided");
    }

}
