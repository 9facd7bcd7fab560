package org.angiofusion.geometry.volume;

/**
 * Thrown for anatomical orientation types whose patient axes are not handled (currently QUADRUPED).
 */
public class UnsupportedOrientationException
        extends UnsupportedOperationException {

    public UnsupportedOrientationException(final AnatomicalOrientationType type) {
        super(type + " anatomical orientation is not supported yet");
    }

}
