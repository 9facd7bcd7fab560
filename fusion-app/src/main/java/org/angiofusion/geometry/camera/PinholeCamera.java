package org.angiofusion.geometry.camera;

import Jama.Matrix;
import Jama.SingularValueDecomposition;

import java.util.List;

import org.angiofusion.geometry.util.DegenerateGeometryException;
import org.angiofusion.geometry.util.MatrixUtil;

/**
 * Projective geometry primitives for an ideal pinhole camera.
 *
 * <p>
 * Notation follows <i>An Invitation to 3-D Vision: From Images to Models</i> (Ma, Soatto, Kosecka, Sastry):
 * world points X<sub>w</sub>, camera points X<sub>c</sub>, camera origin T<sub>wc</sub>
 * and camera to world rotation R<sub>wc</sub> with X<sub>w</sub> = R<sub>wc</sub> X<sub>c</sub> + T<sub>wc</sub>.
 * </p>
 *
 * All methods are stateless.
 */
public class PinholeCamera {

    public static final int MIN_TRIANGULATION_VIEWS = 2;

    /**
     * Builds the intrinsic matrix (eq. 3.14)
     * <pre>
     *     K = [[f / s_x,  0,        o_x],
     *          [0,        f / s_y,  o_y],
     *          [0,        0,        1  ]]
     * </pre>
     * For a C-arm the focal length is the source to detector distance
     * and the pixel spacing (mm/pixel) converts millimetres to pixels.
     *
     * @param  focalLength     focal length in mm.
     * @param  pixelSpacing    (s_x, s_y) in mm/pixel.
     * @param  principalPoint  (o_x, o_y) in pixels.
     */
    public static Matrix intrinsicMatrix(final double focalLength,
                                         final double[] pixelSpacing,
                                         final double[] principalPoint)
            throws IllegalArgumentException {

        MatrixUtil.checkVector(pixelSpacing, 2, "pixelSpacing");
        MatrixUtil.checkVector(principalPoint, 2, "principalPoint");
        if ((pixelSpacing[0] <= 0) || (pixelSpacing[1] <= 0)) {
            throw new IllegalArgumentException("pixelSpacing values must be positive");
        }

        return new Matrix(new double[][] {
                { focalLength / pixelSpacing[0], 0,                              principalPoint[0] },
                { 0,                             focalLength / pixelSpacing[1], principalPoint[1] },
                { 0,                             0,                              1                 }
        });
    }

    /**
     * Maps world points into the camera frame: X<sub>c</sub> = R<sub>wc</sub><sup>-1</sup> (X<sub>w</sub> - T<sub>wc</sub>) (eq. 2.17).
     *
     * @param  worldPoints            n x 3 world points.
     * @param  cameraOrigin           camera origin in world coordinates.
     * @param  cameraToWorldRotation  3x3 rotation taking camera axes to world axes.
     *
     * @return n x 3 camera points.
     *
     * @throws DegenerateGeometryException
     *   if the rotation is singular.
     */
    public static double[][] worldToCamera(final double[][] worldPoints,
                                           final double[] cameraOrigin,
                                           final Matrix cameraToWorldRotation)
            throws DegenerateGeometryException {

        MatrixUtil.checkPoints(worldPoints, 3, "worldPoints");
        MatrixUtil.checkVector(cameraOrigin, 3, "cameraOrigin");

        final Matrix worldToCameraRotation = MatrixUtil.inverse(cameraToWorldRotation, "camera to world rotation");

        final double[][] cameraPoints = new double[worldPoints.length][];
        for (int i = 0; i < worldPoints.length; i++) {
            cameraPoints[i] = MatrixUtil.times(worldToCameraRotation,
                                               MatrixUtil.subtract(worldPoints[i], cameraOrigin));
        }
        return cameraPoints;
    }

    /**
     * Maps camera points into the world frame: X<sub>w</sub> = R<sub>wc</sub> X<sub>c</sub> + T<sub>wc</sub> (eq. 2.17).
     *
     * @param  cameraPoints           n x 3 camera points.
     * @param  cameraOrigin           camera origin in world coordinates.
     * @param  cameraToWorldRotation  3x3 rotation taking camera axes to world axes.
     *
     * @return n x 3 world points.
     */
    public static double[][] cameraToWorld(final double[][] cameraPoints,
                                           final double[] cameraOrigin,
                                           final Matrix cameraToWorldRotation) {

        MatrixUtil.checkPoints(cameraPoints, 3, "cameraPoints");
        MatrixUtil.checkVector(cameraOrigin, 3, "cameraOrigin");

        final double[][] worldPoints = new double[cameraPoints.length][];
        for (int i = 0; i < cameraPoints.length; i++) {
            worldPoints[i] = MatrixUtil.add(MatrixUtil.times(cameraToWorldRotation, cameraPoints[i]), cameraOrigin);
        }
        return worldPoints;
    }

    /**
     * Perspective projection x' = K X<sub>c</sub> / z (eq. 3.6, 3.15).
     *
     * @return n x 2 image points.
     *
     * @throws DegenerateGeometryException
     *   if any camera point has zero depth.
     */
    public static double[][] cameraToImage(final double[][] cameraPoints,
                                           final Matrix intrinsicMatrix)
            throws DegenerateGeometryException {

        MatrixUtil.checkPoints(cameraPoints, 3, "cameraPoints");

        final double[][] imagePoints = new double[cameraPoints.length][];
        for (int i = 0; i < cameraPoints.length; i++) {
            final double depth = cameraPoints[i][2];
            if (depth == 0) {
                throw new DegenerateGeometryException("camera point " + i + " has zero depth and cannot be projected");
            }
            final double[] projected = MatrixUtil.times(intrinsicMatrix, cameraPoints[i]);
            imagePoints[i] = new double[] { projected[0] / depth, projected[1] / depth };
        }
        return imagePoints;
    }

    /**
     * Back projects image points to normalized camera rays (depth 1).
     *
     * @param  imagePoints      n x 2 image points or n x 3 homogeneous image points.
     * @param  intrinsicMatrix  camera intrinsics.
     *
     * @return n x 3 camera points.
     */
    public static double[][] imageToCamera(final double[][] imagePoints,
                                           final Matrix intrinsicMatrix)
            throws DegenerateGeometryException {
        return imageToCamera(imagePoints, intrinsicMatrix, 1.0);
    }

    /**
     * Back projects image points to camera points at the specified depth.
     *
     * @param  imagePoints      n x 2 image points or n x 3 homogeneous image points.
     * @param  intrinsicMatrix  camera intrinsics.
     * @param  depth            scale applied to K<sup>-1</sup> x.
     *
     * @return n x 3 camera points.
     *
     * @throws DegenerateGeometryException
     *   if the intrinsic matrix is singular.
     */
    public static double[][] imageToCamera(final double[][] imagePoints,
                                           final Matrix intrinsicMatrix,
                                           final double depth)
            throws DegenerateGeometryException {

        if (imagePoints == null) {
            throw new IllegalArgumentException("imagePoints must be specified");
        }

        final Matrix inverseIntrinsic = MatrixUtil.inverse(intrinsicMatrix, "intrinsic matrix");

        final double[][] cameraPoints = new double[imagePoints.length][];
        for (int i = 0; i < imagePoints.length; i++) {
            final double[] homogeneous = toHomogeneous(imagePoints[i]);
            cameraPoints[i] = MatrixUtil.scale(MatrixUtil.times(inverseIntrinsic, homogeneous), depth);
        }
        return cameraPoints;
    }

    /**
     * @return the point with a trailing 1 appended when it is 2D, or the point itself when it is already homogeneous.
     */
    public static double[] toHomogeneous(final double[] imagePoint) {
        if (imagePoint == null) {
            throw new IllegalArgumentException("image point must be specified");
        } else if (imagePoint.length == 3) {
            return imagePoint;
        } else if (imagePoint.length != 2) {
            throw new IllegalArgumentException("image point must have 2 (or 3 homogeneous) values");
        }
        return new double[] { imagePoint[0], imagePoint[1], 1.0 };
    }

    /**
     * Triangulates one 3D point from two or more views.
     *
     * <p>
     * For n views the (3n) x (4 + n) system
     * <pre>
     *     [ P_1  -x_1   0   ...   0  ]   [ X   ]
     *     [ P_2   0   -x_2  ...   0  ] * [ l_1 ] = 0
     *     [ ...                      ]   [ ... ]
     *     [ P_n   0    0    ... -x_n ]   [ l_n ]
     * </pre>
     * is solved in the least squares sense by the right singular vector with the smallest
     * singular value; its first four entries are the homogeneous 3D point.
     * </p>
     *
     * @param  projectionMatrices  3x4 projection matrix for each view.
     * @param  imagePoints         2D image point for each view.
     *
     * @return de-homogenized 3D point.
     *
     * @throws UnderdeterminedSystemException
     *   if fewer than two views are provided.
     *
     * @throws DegenerateGeometryException
     *   if the solution lies at infinity.
     */
    public static double[] triangulate(final List<Matrix> projectionMatrices,
                                       final List<double[]> imagePoints)
            throws UnderdeterminedSystemException, DegenerateGeometryException, IllegalArgumentException {

        if (projectionMatrices.size() != imagePoints.size()) {
            throw new IllegalArgumentException("number of projection matrices (" + projectionMatrices.size() +
                                               ") differs from number of image points (" + imagePoints.size() + ")");
        }

        final int numberOfViews = projectionMatrices.size();
        if (numberOfViews < MIN_TRIANGULATION_VIEWS) {
            throw new UnderdeterminedSystemException(numberOfViews);
        }

        final Matrix system = new Matrix(3 * numberOfViews, 4 + numberOfViews);
        for (int view = 0; view < numberOfViews; view++) {

            final Matrix projection = projectionMatrices.get(view);
            if ((projection.getRowDimension() != 3) || (projection.getColumnDimension() != 4)) {
                throw new IllegalArgumentException("projection matrix " + view + " must be 3x4");
            }

            final double[] homogeneous = toHomogeneous(imagePoints.get(view));
            final int firstRow = 3 * view;
            system.setMatrix(firstRow, firstRow + 2, 0, 3, projection);
            for (int i = 0; i < 3; i++) {
                system.set(firstRow + i, 4 + view, -homogeneous[i]);
            }
        }

        // Jama sorts singular values in descending order, so the last column of V is the solution
        final SingularValueDecomposition svd = system.svd();
        final Matrix v = svd.getV();
        final int solutionColumn = v.getColumnDimension() - 1;

        final double w = v.get(3, solutionColumn);
        if (Math.abs(w) < MatrixUtil.SINGULAR_TOLERANCE) {
            throw new DegenerateGeometryException("triangulated point lies at infinity, views may be parallel");
        }

        return new double[] {
                v.get(0, solutionColumn) / w,
                v.get(1, solutionColumn) / w,
                v.get(2, solutionColumn) / w
        };
    }

}
