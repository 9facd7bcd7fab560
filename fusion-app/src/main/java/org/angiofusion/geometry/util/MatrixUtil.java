package org.angiofusion.geometry.util;

import Jama.LUDecomposition;
import Jama.Matrix;

import java.util.Arrays;

/**
 * Small set of vector and matrix helpers shared by the geometry components.
 * Points are plain {@code double[]} instances and point sets are {@code double[n][dimension]} arrays.
 */
public class MatrixUtil {

    /** Determinants smaller than this are treated as singular. */
    public static final double SINGULAR_TOLERANCE = 1e-12;

    /**
     * @param  matrix  square matrix to invert.
     * @param  name    name of the matrix for error messages.
     *
     * @return the inverse of the specified matrix.
     *
     * @throws DegenerateGeometryException
     *   if the matrix is not square or is (numerically) singular.
     */
    public static Matrix inverse(final Matrix matrix,
                                 final String name)
            throws DegenerateGeometryException {

        if (matrix.getRowDimension() != matrix.getColumnDimension()) {
            throw new DegenerateGeometryException(name + " must be square but is " +
                                                  matrix.getRowDimension() + "x" + matrix.getColumnDimension());
        }

        final LUDecomposition lu = new LUDecomposition(matrix);
        if ((! lu.isNonsingular()) || (Math.abs(lu.det()) < SINGULAR_TOLERANCE)) {
            throw new DegenerateGeometryException(name + " is singular and cannot be inverted");
        }

        return lu.solve(Matrix.identity(matrix.getRowDimension(), matrix.getColumnDimension()));
    }

    /**
     * @return product of the matrix and the column vector.
     */
    public static double[] times(final Matrix matrix,
                                 final double[] vector) {
        if (matrix.getColumnDimension() != vector.length) {
            throw new IllegalArgumentException("cannot multiply " + matrix.getRowDimension() + "x" +
                                               matrix.getColumnDimension() + " matrix with vector of length " +
                                               vector.length);
        }
        final double[][] m = matrix.getArray();
        final double[] result = new double[m.length];
        for (int row = 0; row < m.length; row++) {
            double sum = 0;
            for (int column = 0; column < vector.length; column++) {
                sum += m[row][column] * vector[column];
            }
            result[row] = sum;
        }
        return result;
    }

    /**
     * @return a new point set with the matrix applied to each point.
     */
    public static double[][] times(final Matrix matrix,
                                   final double[][] points) {
        final double[][] result = new double[points.length][];
        for (int i = 0; i < points.length; i++) {
            result[i] = times(matrix, points[i]);
        }
        return result;
    }

    public static double[] add(final double[] a,
                               final double[] b) {
        checkSameLength(a, b);
        final double[] result = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            result[i] = a[i] + b[i];
        }
        return result;
    }

    public static double[] subtract(final double[] a,
                                    final double[] b) {
        checkSameLength(a, b);
        final double[] result = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            result[i] = a[i] - b[i];
        }
        return result;
    }

    public static double[] scale(final double[] a,
                                 final double factor) {
        final double[] result = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            result[i] = a[i] * factor;
        }
        return result;
    }

    public static double[] cross(final double[] a,
                                 final double[] b) {
        if ((a.length != 3) || (b.length != 3)) {
            throw new IllegalArgumentException("cross product requires two 3D vectors");
        }
        return new double[] {
                a[1] * b[2] - a[2] * b[1],
                a[2] * b[0] - a[0] * b[2],
                a[0] * b[1] - a[1] * b[0]
        };
    }

    public static double norm(final double[] a) {
        double sumOfSquares = 0;
        for (final double value : a) {
            sumOfSquares += value * value;
        }
        return Math.sqrt(sumOfSquares);
    }

    /**
     * @return a copy of the specified 3x3 constant as a Jama matrix.
     */
    public static Matrix copyOf(final double[][] values) {
        return Matrix.constructWithCopy(values);
    }

    /**
     * @return a deep copy of the specified point set.
     */
    public static double[][] copyOf(final double[][] points,
                                    final int dimension) {
        checkPoints(points, dimension, "points");
        final double[][] copy = new double[points.length][];
        for (int i = 0; i < points.length; i++) {
            copy[i] = Arrays.copyOf(points[i], dimension);
        }
        return copy;
    }

    /**
     * @throws IllegalArgumentException
     *   if the point set is null or any point does not have the expected dimension.
     */
    public static void checkPoints(final double[][] points,
                                   final int dimension,
                                   final String name)
            throws IllegalArgumentException {
        if (points == null) {
            throw new IllegalArgumentException(name + " must be specified");
        }
        for (int i = 0; i < points.length; i++) {
            if ((points[i] == null) || (points[i].length != dimension)) {
                throw new IllegalArgumentException(name + "[" + i + "] must have exactly " + dimension + " values");
            }
        }
    }

    /**
     * @throws IllegalArgumentException
     *   if the vector is null or does not have the expected length.
     */
    public static void checkVector(final double[] vector,
                                   final int length,
                                   final String name)
            throws IllegalArgumentException {
        if ((vector == null) || (vector.length != length)) {
            throw new IllegalArgumentException(name + " must have exactly " + length + " values");
        }
    }

    private static void checkSameLength(final double[] a,
                                        final double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("vector lengths differ (" + a.length + " and " + b.length + ")");
        }
    }

}
