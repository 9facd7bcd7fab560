package org.angiofusion.geometry.volume;

/**
 * DICOM Anatomical Orientation Type (0010,2210) values.
 */
public enum AnatomicalOrientationType {

    BIPED,
    QUADRUPED;

    /**
     * @return the type for a decoded attribute value, where an absent value means {@link #BIPED}.
     *
     * @throws IllegalArgumentException
     *   if the value is not a known type.
     */
    public static AnatomicalOrientationType fromDicomValue(final String value)
            throws IllegalArgumentException {
        if ((value == null) || value.trim().isEmpty()) {
            return BIPED;
        }
        return valueOf(value.trim().toUpperCase());
    }

}
