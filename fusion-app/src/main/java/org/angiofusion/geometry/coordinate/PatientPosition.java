package org.angiofusion.geometry.coordinate;

/**
 * Patient table orientations.
 */
public enum PatientPosition {

    /** Head first, supine. */
    HFS,

    /** Feet first, supine. */
    FFS

}
