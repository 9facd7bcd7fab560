package org.angiofusion.geometry.coordinate;

import Jama.Matrix;

import java.util.Arrays;

import org.angiofusion.geometry.util.MatrixUtil;

/**
 * A set of 3D points tagged with the coordinate system they are expressed in.
 *
 * <p>
 * Instances are immutable: every operation returns a new instance and the point data
 * is copied on the way in and on the way out.
 * </p>
 */
public class PatientCoordinates {

    private final double[][] points;
    private final CoordinateSystem coordinateSystem;

    /**
     * @param  points            n x 3 point set (may be empty).
     * @param  coordinateSystem  system the points are expressed in.
     *
     * @throws IllegalArgumentException
     *   if any point does not have 3 values or the coordinate system is missing.
     */
    public PatientCoordinates(final double[][] points,
                              final CoordinateSystem coordinateSystem)
            throws IllegalArgumentException {
        if (coordinateSystem == null) {
            throw new IllegalArgumentException("coordinate system must be specified");
        }
        this.points = MatrixUtil.copyOf(points, 3);
        this.coordinateSystem = coordinateSystem;
    }

    /**
     * @return single point instance.
     */
    public static PatientCoordinates ofPoint(final double[] point,
                                             final CoordinateSystem coordinateSystem) {
        MatrixUtil.checkVector(point, 3, "point");
        return new PatientCoordinates(new double[][] { point }, coordinateSystem);
    }

    public CoordinateSystem getCoordinateSystem() {
        return coordinateSystem;
    }

    public int size() {
        return points.length;
    }

    public double[][] getPoints() {
        return MatrixUtil.copyOf(points, 3);
    }

    public double[] getPoint(final int index) {
        return Arrays.copyOf(points[index], 3);
    }

    /**
     * @return these points expressed in the specified coordinate system.
     *
     * @throws UnsupportedTransformException
     *   if no direct transform exists to the target system.
     */
    public PatientCoordinates toCoordinateSystem(final CoordinateSystem target)
            throws UnsupportedTransformException {
        final Matrix transform = TransformationMatrix.getCoordinateTransform(coordinateSystem, target);
        return new PatientCoordinates(MatrixUtil.times(transform, points), target);
    }

    /**
     * @param  patientPosition  position of the patient when the points were acquired.
     *
     * @return these points mapped into the world frame
     *         (tagged with {@link TransformationMatrix#WORLD_COORDINATE_SYSTEM}).
     */
    public PatientCoordinates toWorld(final PatientPosition patientPosition)
            throws UnsupportedTransformException {
        final Matrix transform = TransformationMatrix.patientToWorldTransform(patientPosition, coordinateSystem);
        return new PatientCoordinates(MatrixUtil.times(transform, points),
                                      TransformationMatrix.WORLD_COORDINATE_SYSTEM);
    }

    /**
     * Adds point sets element by element. A single point operand is added to every point.
     *
     * @throws IncompatibleFramesException
     *   if the operands are expressed in different coordinate systems.
     */
    public PatientCoordinates add(final PatientCoordinates other)
            throws IncompatibleFramesException, IllegalArgumentException {
        return combine(other, 1.0);
    }

    /**
     * Subtracts point sets element by element. A single point operand is subtracted from every point.
     *
     * @throws IncompatibleFramesException
     *   if the operands are expressed in different coordinate systems.
     */
    public PatientCoordinates subtract(final PatientCoordinates other)
            throws IncompatibleFramesException, IllegalArgumentException {
        return combine(other, -1.0);
    }

    @Override
    public String toString() {
        return "{ \"coordinateSystem\": \"" + coordinateSystem + "\", \"size\": " + points.length + " }";
    }

    private PatientCoordinates combine(final PatientCoordinates other,
                                       final double sign) {

        if (coordinateSystem != other.coordinateSystem) {
            throw new IncompatibleFramesException(coordinateSystem, other.coordinateSystem);
        }

        final boolean broadcast = (other.points.length == 1);
        if ((! broadcast) && (other.points.length != points.length)) {
            throw new IllegalArgumentException("cannot combine " + points.length + " points with " +
                                               other.points.length + " points");
        }

        final double[][] result = new double[points.length][];
        for (int i = 0; i < points.length; i++) {
            final double[] otherPoint = broadcast ? other.points[0] : other.points[i];
            result[i] = MatrixUtil.add(points[i], MatrixUtil.scale(otherPoint, sign));
        }

        return new PatientCoordinates(result, coordinateSystem);
    }

}
