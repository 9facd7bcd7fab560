package org.angiofusion.geometry.volume;

/**
 * Thrown when a DICOM geometry attribute required for a computation is absent.
 */
public class MissingGeometryException
        extends IllegalArgumentException {

    public MissingGeometryException(final String message) {
        super(message);
    }

    public static MissingGeometryException forSlice(final String attributeName,
                                                    final int sliceIndex) {
        return new MissingGeometryException(attributeName + " is not defined for slice " + sliceIndex);
    }

}
