package org.angiofusion.geometry.volume;

/**
 * Thrown when neither Spacing Between Slices nor Slice Thickness is available.
 */
public class MissingSpacingException
        extends MissingGeometryException {

    public MissingSpacingException() {
        super("spacing between slices is not defined (neither SpacingBetweenSlices nor SliceThickness is present)");
    }

}
