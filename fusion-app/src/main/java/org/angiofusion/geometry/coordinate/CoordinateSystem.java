package org.angiofusion.geometry.coordinate;

/**
 * Named anatomical coordinate systems.
 */
public enum CoordinateSystem {

    /** Left-Posterior-Superior, the DICOM patient (RCS) frame. */
    LPS,

    /** Right-Anterior-Superior, the radiological convention. */
    RAS,

    /** Inferior-Left-Anterior, the native C-arm frame. */
    ILA

}
