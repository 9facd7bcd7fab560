package org.angiofusion.geometry.carm;

/**
 * Thrown when a capture is requested without a point cloud and none has been bound.
 */
public class NoTargetObjectException
        extends IllegalStateException {

    public NoTargetObjectException() {
        super("set target object using setTargetObject before capturing");
    }

}
