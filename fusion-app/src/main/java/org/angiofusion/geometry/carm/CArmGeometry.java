package org.angiofusion.geometry.carm;

import Jama.Matrix;

import org.angiofusion.geometry.coordinate.CoordinateSystem;

/**
 * Frame-agnostic view of C-arm projection geometry.
 * Every vector and matrix is expressed in {@link #getCoordinateSystem()}.
 */
public interface CArmGeometry {

    /**
     * @return coordinate system of all points, vectors and matrices reported by this geometry.
     */
    CoordinateSystem getCoordinateSystem();

    /**
     * @return 3x3 rotation taking source (camera) axes to world axes.
     */
    Matrix getRotation();

    double[] getSourceBasisVectorX();

    double[] getSourceBasisVectorY();

    double[] getSourceBasisVectorZ();

    /**
     * @return physical detector size in mm as (rows * row spacing, columns * column spacing).
     */
    double[] getDetectorSize();

    /**
     * @return X-ray source location after applying the table offset (the camera center).
     */
    double[] getSourcePoint();

    /**
     * @return center of the detector plane.
     */
    double[] getDetectorCenterPoint();

    Matrix getIntrinsicMatrix();

    /**
     * @return 3x4 world to camera matrix [R|T].
     */
    Matrix getExtrinsicMatrix();

    /**
     * @return 3x4 projection matrix K [R|T].
     */
    Matrix getProjectionMatrix();

    /**
     * @return world location of the detector's first pixel corner.
     */
    double[] getImageOrigin();

    int getRows();

    int getColumns();

    /**
     * @return detector (imager) pixel spacing in mm/pixel as (row spacing, column spacing).
     */
    double[] getImagerPixelSpacing();

    /**
     * @param  worldPoints  n x 3 points in this geometry's coordinate system.
     *
     * @return n x 2 image points.
     */
    double[][] capture(double[][] worldPoints);

    /**
     * @return image points for the currently bound target object.
     *
     * @throws NoTargetObjectException
     *   if no target object has been bound.
     */
    double[][] capture() throws NoTargetObjectException;

    /**
     * Back projects image points onto the detector plane (depth = SID).
     *
     * @param  imagePoints  n x 2 image points.
     *
     * @return n x 3 world points.
     */
    double[][] imageToWorld(double[][] imagePoints);

}
