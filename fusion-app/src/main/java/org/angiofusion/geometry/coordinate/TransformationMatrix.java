package org.angiofusion.geometry.coordinate;

import Jama.Matrix;

import org.angiofusion.geometry.util.MatrixUtil;

/**
 * Fixed transformation matrices between anatomical coordinate systems and between patient positions.
 *
 * <p>
 * Every matrix is a signed permutation, so the inverse of a direct transform is its transpose.
 * Only the direct pairs listed below are defined; callers needing other conversions
 * must compose them explicitly (see {@link #patientToWorldTransform}).
 * </p>
 *
 * <pre>
 *     RAS -> LPS    diag(-1, -1, 1)
 *     RAS -> ILA    [[0, 0, -1], [-1, 0, 0], [0, 1, 0]]
 *     LPS -> RAS    diag(-1, -1, 1)
 *     LPS -> ILA    [[0, 0, -1], [1, 0, 0], [0, -1, 0]]
 *     ILA -> LPS    [[0, 1, 0], [0, 0, -1], [-1, 0, 0]]
 *     ILA -> RAS    [[0, -1, 0], [0, 0, 1], [-1, 0, 0]]
 *     HFS <-> FFS   diag(-1, 1, -1)
 * </pre>
 */
public class TransformationMatrix {

    /** The canonical world coordinate system. */
    public static final CoordinateSystem WORLD_COORDINATE_SYSTEM = CoordinateSystem.ILA;

    /** The canonical world patient position. */
    public static final PatientPosition WORLD_PATIENT_POSITION = PatientPosition.HFS;

    private static final double[][] RAS_TO_LPS = {
            {-1,  0,  0},
            { 0, -1,  0},
            { 0,  0,  1}
    };

    private static final double[][] RAS_TO_ILA = {
            { 0,  0, -1},
            {-1,  0,  0},
            { 0,  1,  0}
    };

    private static final double[][] LPS_TO_RAS = {
            {-1,  0,  0},
            { 0, -1,  0},
            { 0,  0,  1}
    };

    private static final double[][] LPS_TO_ILA = {
            { 0,  0, -1},
            { 1,  0,  0},
            { 0, -1,  0}
    };

    private static final double[][] ILA_TO_LPS = {
            { 0,  1,  0},
            { 0,  0, -1},
            {-1,  0,  0}
    };

    private static final double[][] ILA_TO_RAS = {
            { 0, -1,  0},
            { 0,  0,  1},
            {-1,  0,  0}
    };

    private static final double[][] FLIP_HEAD_FEET = {
            {-1,  0,  0},
            { 0,  1,  0},
            { 0,  0, -1}
    };

    /**
     * @param  from  source coordinate system.
     * @param  to    target coordinate system.
     *
     * @return 3x3 matrix mapping a point expressed in the source system
     *         to the same physical point expressed in the target system.
     *
     * @throws UnsupportedTransformException
     *   if there is no direct transform between the systems.
     */
    public static Matrix getCoordinateTransform(final CoordinateSystem from,
                                                final CoordinateSystem to)
            throws UnsupportedTransformException {

        if ((from != null) && (from == to)) {
            return Matrix.identity(3, 3);
        }

        final double[][] values = findCoordinateTransform(from, to);
        if (values == null) {
            throw new UnsupportedTransformException(from, to);
        }

        return MatrixUtil.copyOf(values);
    }

    /**
     * @param  from  source patient position.
     * @param  to    target patient position.
     *
     * @return 3x3 matrix mapping a point for the source position to the target position.
     *
     * @throws UnsupportedTransformException
     *   if there is no direct transform between the positions.
     */
    public static Matrix getPositionTransform(final PatientPosition from,
                                              final PatientPosition to)
            throws UnsupportedTransformException {

        if ((from != null) && (from == to)) {
            return Matrix.identity(3, 3);
        }

        if ((from == null) || (to == null)) {
            throw new UnsupportedTransformException(from, to);
        }

        // the only remaining pairs are HFS -> FFS and FFS -> HFS
        return MatrixUtil.copyOf(FLIP_HEAD_FEET);
    }

    /**
     * Composes the transform from patient space to world space: the patient position is
     * first mapped to {@link #WORLD_PATIENT_POSITION} and the result is then mapped from the
     * specified coordinate system to {@link #WORLD_COORDINATE_SYSTEM}.
     *
     * @param  patientPosition  position of the patient on the table.
     * @param  coordinateSystem coordinate system the patient points are expressed in.
     *
     * @return combined 3x3 transform.
     */
    public static Matrix patientToWorldTransform(final PatientPosition patientPosition,
                                                 final CoordinateSystem coordinateSystem)
            throws UnsupportedTransformException {

        Matrix transform = Matrix.identity(3, 3);

        if (patientPosition != WORLD_PATIENT_POSITION) {
            transform = getPositionTransform(patientPosition, WORLD_PATIENT_POSITION).times(transform);
        }

        if (coordinateSystem != WORLD_COORDINATE_SYSTEM) {
            transform = getCoordinateTransform(coordinateSystem, WORLD_COORDINATE_SYSTEM).times(transform);
        }

        return transform;
    }

    private static double[][] findCoordinateTransform(final CoordinateSystem from,
                                                      final CoordinateSystem to) {
        if ((from == null) || (to == null)) {
            return null;
        }

        double[][] values = null;
        switch (from) {
            case RAS:
                values = (to == CoordinateSystem.LPS) ? RAS_TO_LPS : RAS_TO_ILA;
                break;
            case LPS:
                values = (to == CoordinateSystem.RAS) ? LPS_TO_RAS : LPS_TO_ILA;
                break;
            case ILA:
                values = (to == CoordinateSystem.LPS) ? ILA_TO_LPS : ILA_TO_RAS;
                break;
        }
        return values;
    }

}
