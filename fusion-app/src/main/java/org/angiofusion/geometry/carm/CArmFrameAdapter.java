package org.angiofusion.geometry.carm;

import Jama.Matrix;

import org.angiofusion.geometry.coordinate.CoordinateSystem;
import org.angiofusion.geometry.coordinate.TransformationMatrix;
import org.angiofusion.geometry.util.MatrixUtil;

/**
 * Re-expresses the geometry of a {@link CArm} in another anatomical frame
 * (LPS for alignment with DICOM volume data).
 *
 * <p>
 * The adapter holds a live reference to the wrapped C-arm, so in-place pose changes
 * ({@link CArm#rotate}, {@link CArm#tableMove}, {@link CArm#moveDetector}) are immediately
 * visible through the adapter. It has no state of its own beyond the fixed frame transform.
 * </p>
 */
public class CArmFrameAdapter
        implements CArmGeometry {

    private final CArm carm;
    private final CoordinateSystem coordinateSystem;
    private final Matrix nativeToTarget;
    private final Matrix targetToNative;

    /**
     * @return adapter reporting the C-arm geometry in LPS.
     */
    public static CArmFrameAdapter lps(final CArm carm) {
        return new CArmFrameAdapter(carm, CoordinateSystem.LPS);
    }

    /**
     * @param  carm              C-arm to wrap (not copied).
     * @param  coordinateSystem  frame to report geometry in.
     *
     * @throws org.angiofusion.geometry.coordinate.UnsupportedTransformException
     *   if there is no direct transform from the C-arm frame to the target frame.
     */
    public CArmFrameAdapter(final CArm carm,
                            final CoordinateSystem coordinateSystem) {
        if (carm == null) {
            throw new IllegalArgumentException("carm must be specified");
        }
        this.carm = carm;
        this.coordinateSystem = coordinateSystem;
        this.nativeToTarget = TransformationMatrix.getCoordinateTransform(carm.getCoordinateSystem(), coordinateSystem);
        this.targetToNative = MatrixUtil.inverse(nativeToTarget, "frame transform");
    }

    public CArm getCArm() {
        return carm;
    }

    /**
     * @return copy of the fixed transform from the C-arm frame to this adapter's frame.
     */
    public Matrix getFrameTransform() {
        return nativeToTarget.copy();
    }

    @Override
    public CoordinateSystem getCoordinateSystem() {
        return coordinateSystem;
    }

    public double[][] toNative(final double[][] points) {
        MatrixUtil.checkPoints(points, 3, "points");
        return MatrixUtil.times(targetToNative, points);
    }

    public double[][] fromNative(final double[][] points) {
        MatrixUtil.checkPoints(points, 3, "points");
        return MatrixUtil.times(nativeToTarget, points);
    }

    @Override
    public Matrix getRotation() {
        return nativeToTarget.times(carm.getRotation());
    }

    @Override
    public double[] getSourceBasisVectorX() {
        return MatrixUtil.times(nativeToTarget, carm.getSourceBasisVectorX());
    }

    @Override
    public double[] getSourceBasisVectorY() {
        return MatrixUtil.times(nativeToTarget, carm.getSourceBasisVectorY());
    }

    @Override
    public double[] getSourceBasisVectorZ() {
        return MatrixUtil.times(nativeToTarget, carm.getSourceBasisVectorZ());
    }

    @Override
    public double[] getDetectorSize() {
        return carm.getDetectorSize();
    }

    @Override
    public double[] getSourcePoint() {
        return MatrixUtil.times(nativeToTarget, carm.getSourcePoint());
    }

    @Override
    public double[] getDetectorCenterPoint() {
        return MatrixUtil.times(nativeToTarget, carm.getDetectorCenterPoint());
    }

    @Override
    public Matrix getIntrinsicMatrix() {
        return carm.getIntrinsicMatrix();
    }

    @Override
    public Matrix getExtrinsicMatrix() {
        return CArm.buildExtrinsicMatrix(getRotation(), getSourcePoint());
    }

    @Override
    public Matrix getProjectionMatrix() {
        return getIntrinsicMatrix().times(getExtrinsicMatrix());
    }

    @Override
    public double[] getImageOrigin() {
        return MatrixUtil.times(nativeToTarget, carm.getImageOrigin());
    }

    @Override
    public int getRows() {
        return carm.getRows();
    }

    @Override
    public int getColumns() {
        return carm.getColumns();
    }

    @Override
    public double[] getImagerPixelSpacing() {
        return carm.getImagerPixelSpacing();
    }

    /**
     * Binds a point cloud expressed in this adapter's frame to the wrapped C-arm.
     */
    public void setTargetObject(final double[][] points) {
        carm.setTargetObject(toNative(points));
    }

    /**
     * @param  worldPoints  n x 3 points in this adapter's frame.
     *
     * @return n x 2 image points (image coordinates do not depend on the world frame).
     */
    @Override
    public double[][] capture(final double[][] worldPoints) {
        return carm.capture(toNative(worldPoints));
    }

    @Override
    public double[][] capture()
            throws NoTargetObjectException {
        return carm.capture();
    }

    @Override
    public double[][] imageToWorld(final double[][] imagePoints) {
        return MatrixUtil.times(nativeToTarget, carm.imageToWorld(imagePoints));
    }

    @Override
    public String toString() {
        return "{ \"coordinateSystem\": \"" + coordinateSystem + "\", \"carm\": " + carm + " }";
    }

}
