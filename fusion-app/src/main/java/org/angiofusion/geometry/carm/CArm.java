package org.angiofusion.geometry.carm;

import Jama.Matrix;

import java.util.Arrays;

import org.angiofusion.geometry.camera.PinholeCamera;
import org.angiofusion.geometry.coordinate.CoordinateSystem;
import org.angiofusion.geometry.util.MatrixUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pinhole model of a C-arm gantry derived from clinical acquisition parameters.
 *
 * <p>
 * All geometry is expressed in the C-arm's native ILA (Inferior-Left-Anterior) frame with the
 * world origin at the isocenter. Positioner angles follow the DICOM definitions
 * (<a href="https://dicom.nema.org/medical/dicom/current/output/chtml/part03/sect_C.8.7.5.html">C.8.7.5</a>):
 * the primary angle alpha (LAO+ / RAO-) rotates the source about the ILA x axis and the secondary
 * angle beta (CRAN+ / CAUD-) about the ILA y axis, both with negated sign in this frame.
 * Since the patient is stationary, table motion is modelled as the C-arm moving the opposite way.
 * </p>
 *
 * <p>
 * Two kinds of updates are supported. {@link #rotate}, {@link #tableMove} and {@link #moveDetector}
 * mutate this instance in place, which is what {@link CArmFrameAdapter} relies on since it holds a
 * live reference. {@link #withUpdates} returns an independent instance and leaves this one untouched.
 * In-place mutation is not synchronized: callers sharing an instance across threads must serialize it.
 * </p>
 */
public class CArm
        implements CArmGeometry {

    private static final double[] INIT_SOURCE_BASIS_VECTOR_X = { 1, 0, 0 };
    private static final double[] INIT_SOURCE_BASIS_VECTOR_Y = { 0, 1, 0 };
    private static final double[] INIT_SOURCE_BASIS_VECTOR_Z = { 0, 0, 1 };

    private double alpha;
    private double beta;
    private double sid;
    private final double sod;
    private final double sisod;
    private double[] imagerPixelSpacing;
    private final int rows;
    private final int columns;
    private double[] tableTopPosition;

    private final double[] initSourcePoint;
    private final double[] detectorCenterPoint2d;
    private double[] isocentricSourcePoint;
    private double[][] targetObject;

    /**
     * Constructs a C-arm whose source to isocenter distance equals the source to patient distance.
     */
    public CArm(final double alpha,
                final double beta,
                final double sid,
                final double sod,
                final double[] imagerPixelSpacing,
                final int rows,
                final int columns,
                final double[] tableTopPosition)
            throws IllegalArgumentException {
        this(alpha, beta, sid, sod, imagerPixelSpacing, rows, columns, tableTopPosition, null);
    }

    /**
     * @param  alpha               positioner primary angle in degrees.
     * @param  beta                positioner secondary angle in degrees.
     * @param  sid                 source to detector distance in mm.
     * @param  sod                 source to patient distance in mm.
     * @param  imagerPixelSpacing  detector (row spacing, column spacing) in mm/pixel.
     * @param  rows                detector rows.
     * @param  columns             detector columns.
     * @param  tableTopPosition    relative table offset in mm.
     * @param  sisod               source to isocenter distance in mm (null to use sod).
     *
     * @throws IllegalArgumentException
     *   if any distance, spacing or detector dimension is not positive.
     */
    public CArm(final double alpha,
                final double beta,
                final double sid,
                final double sod,
                final double[] imagerPixelSpacing,
                final int rows,
                final int columns,
                final double[] tableTopPosition,
                final Double sisod)
            throws IllegalArgumentException {

        checkPositive(sid, "sid");
        checkPositive(sod, "sod");
        if (sisod != null) {
            checkPositive(sisod, "sisod");
        }
        checkImagerPixelSpacing(imagerPixelSpacing);
        if ((rows <= 0) || (columns <= 0)) {
            throw new IllegalArgumentException("rows and columns must be positive but are " + rows + " and " + columns);
        }
        MatrixUtil.checkVector(tableTopPosition, 3, "tableTopPosition");

        this.sid = sid;
        this.sod = sod;
        this.sisod = (sisod == null) ? sod : sisod;
        this.imagerPixelSpacing = Arrays.copyOf(imagerPixelSpacing, 2);
        this.rows = rows;
        this.columns = columns;
        this.tableTopPosition = Arrays.copyOf(tableTopPosition, 3);

        this.initSourcePoint = MatrixUtil.scale(INIT_SOURCE_BASIS_VECTOR_Z, -this.sisod);
        this.detectorCenterPoint2d = new double[] { (columns - 1) / 2.0, (rows - 1) / 2.0 };
        this.targetObject = null;

        rotate(alpha, beta);
    }

    /**
     * @return a new instance with the specified pose that shares this instance's detector and distances.
     *         This instance is not modified and no target object is carried over.
     */
    public CArm withUpdates(final double alpha,
                            final double beta,
                            final double[] tableTopPosition)
            throws IllegalArgumentException {
        return new CArm(alpha, beta, sid, sod, imagerPixelSpacing, rows, columns, tableTopPosition, sisod);
    }

    /**
     * @return snapshot of the current acquisition parameters.
     */
    public CArmParameters getParameters() {
        return new CArmParameters(alpha, beta, sid, sod, sisod, imagerPixelSpacing, rows, columns, tableTopPosition);
    }

    /**
     * @return pose as (alpha, beta, table x, table y, table z).
     */
    public double[] getRotationTranslationParameters() {
        return new double[] { alpha, beta, tableTopPosition[0], tableTopPosition[1], tableTopPosition[2] };
    }

    @Override
    public CoordinateSystem getCoordinateSystem() {
        return CoordinateSystem.ILA;
    }

    public double getAlpha() {
        return alpha;
    }

    public double getBeta() {
        return beta;
    }

    public double getSid() {
        return sid;
    }

    public double getSod() {
        return sod;
    }

    public double getSisod() {
        return sisod;
    }

    @Override
    public int getRows() {
        return rows;
    }

    @Override
    public int getColumns() {
        return columns;
    }

    @Override
    public double[] getImagerPixelSpacing() {
        return Arrays.copyOf(imagerPixelSpacing, 2);
    }

    public double[] getTableTopPosition() {
        return Arrays.copyOf(tableTopPosition, 3);
    }

    /**
     * Builds the rotation scipy produces for {@code Rotation.from_euler("xyz", [-alpha, -beta, 0], degrees=True)}:
     * extrinsic rotations about the fixed x then y axes, R = R<sub>y</sub>(-beta) R<sub>x</sub>(-alpha).
     *
     * @param  alpha  positioner primary angle in degrees.
     * @param  beta   positioner secondary angle in degrees.
     *
     * @return 3x3 source to world rotation.
     */
    public static Matrix buildRotation(final double alpha,
                                       final double beta) {

        final double a = Math.toRadians(-alpha);
        final double b = Math.toRadians(-beta);
        final double cosA = Math.cos(a);
        final double sinA = Math.sin(a);
        final double cosB = Math.cos(b);
        final double sinB = Math.sin(b);

        final Matrix rotationX = new Matrix(new double[][] {
                { 1,    0,     0    },
                { 0,    cosA, -sinA },
                { 0,    sinA,  cosA }
        });

        final Matrix rotationY = new Matrix(new double[][] {
                {  cosB, 0, sinB },
                {  0,    1, 0    },
                { -sinB, 0, cosB }
        });

        return rotationY.times(rotationX);
    }

    @Override
    public Matrix getRotation() {
        return buildRotation(alpha, beta);
    }

    @Override
    public double[] getSourceBasisVectorX() {
        return MatrixUtil.times(getRotation(), INIT_SOURCE_BASIS_VECTOR_X);
    }

    @Override
    public double[] getSourceBasisVectorY() {
        return MatrixUtil.times(getRotation(), INIT_SOURCE_BASIS_VECTOR_Y);
    }

    @Override
    public double[] getSourceBasisVectorZ() {
        return MatrixUtil.times(getRotation(), INIT_SOURCE_BASIS_VECTOR_Z);
    }

    @Override
    public double[] getDetectorSize() {
        return new double[] {
                rows * imagerPixelSpacing[0],
                columns * imagerPixelSpacing[1]
        };
    }

    /**
     * @return source location for the current angles ignoring the table offset.
     */
    public double[] getIsocentricSourcePoint() {
        return Arrays.copyOf(isocentricSourcePoint, 3);
    }

    @Override
    public double[] getSourcePoint() {
        return MatrixUtil.subtract(isocentricSourcePoint, tableTopPosition);
    }

    @Override
    public double[] getDetectorCenterPoint() {
        return MatrixUtil.add(getSourcePoint(), MatrixUtil.scale(getSourceBasisVectorZ(), sid));
    }

    @Override
    public Matrix getIntrinsicMatrix() {
        return PinholeCamera.intrinsicMatrix(sid, imagerPixelSpacing, detectorCenterPoint2d);
    }

    @Override
    public Matrix getExtrinsicMatrix() {
        return buildExtrinsicMatrix(getRotation(), getSourcePoint());
    }

    @Override
    public Matrix getProjectionMatrix() {
        return getIntrinsicMatrix().times(getExtrinsicMatrix());
    }

    @Override
    public double[] getImageOrigin() {
        final double[] detectorSize = getDetectorSize();
        double[] origin = getDetectorCenterPoint();
        origin = MatrixUtil.subtract(origin, MatrixUtil.scale(getSourceBasisVectorX(), detectorSize[0] / 2));
        origin = MatrixUtil.subtract(origin, MatrixUtil.scale(getSourceBasisVectorY(), detectorSize[1] / 2));
        return origin;
    }

    /**
     * Changes the source to detector distance and detector spacing in place.
     */
    public void moveDetector(final double sid,
                             final double[] imagerPixelSpacing)
            throws IllegalArgumentException {
        checkPositive(sid, "sid");
        checkImagerPixelSpacing(imagerPixelSpacing);
        this.sid = sid;
        this.imagerPixelSpacing = Arrays.copyOf(imagerPixelSpacing, 2);
        LOG.debug("moveDetector: sid is {}, imagerPixelSpacing is {}", sid, Arrays.toString(imagerPixelSpacing));
    }

    /**
     * Changes the positioner angles in place and recomputes the source point.
     *
     * @param  alpha  positioner primary angle in degrees.
     * @param  beta   positioner secondary angle in degrees.
     */
    public void rotate(final double alpha,
                       final double beta) {
        if (Double.isNaN(alpha) || Double.isInfinite(alpha) || Double.isNaN(beta) || Double.isInfinite(beta)) {
            throw new IllegalArgumentException("angles must be finite but are " + alpha + " and " + beta);
        }
        this.alpha = alpha;
        this.beta = beta;
        this.isocentricSourcePoint = MatrixUtil.times(getRotation(), initSourcePoint);
        LOG.debug("rotate: alpha is {}, beta is {}, source point is {}",
                  alpha, beta, Arrays.toString(isocentricSourcePoint));
    }

    /**
     * Changes the relative table offset in place.
     */
    public void tableMove(final double[] tableTopPosition) {
        MatrixUtil.checkVector(tableTopPosition, 3, "tableTopPosition");
        this.tableTopPosition = Arrays.copyOf(tableTopPosition, 3);
    }

    /**
     * Binds a point cloud (ILA) to be projected by {@link #capture()}.
     */
    public void setTargetObject(final double[][] targetObject) {
        this.targetObject = MatrixUtil.copyOf(targetObject, 3);
    }

    public boolean hasTargetObject() {
        return targetObject != null;
    }

    @Override
    public double[][] capture(final double[][] worldPoints) {
        final double[][] cameraPoints = PinholeCamera.worldToCamera(worldPoints, getSourcePoint(), getRotation());
        return PinholeCamera.cameraToImage(cameraPoints, getIntrinsicMatrix());
    }

    @Override
    public double[][] capture()
            throws NoTargetObjectException {
        if (targetObject == null) {
            throw new NoTargetObjectException();
        }
        return capture(targetObject);
    }

    @Override
    public double[][] imageToWorld(final double[][] imagePoints) {
        final double[][] cameraPoints = PinholeCamera.imageToCamera(imagePoints, getIntrinsicMatrix(), sid);
        return PinholeCamera.cameraToWorld(cameraPoints, getSourcePoint(), getRotation());
    }

    @Override
    public String toString() {
        return getParameters().toString();
    }

    /**
     * @return [R|T] with R = rotation<sup>-1</sup> and T = R (-sourcePoint).
     */
    static Matrix buildExtrinsicMatrix(final Matrix rotation,
                                       final double[] sourcePoint) {
        final Matrix r = MatrixUtil.inverse(rotation, "rotation");
        final double[] t = MatrixUtil.times(r, MatrixUtil.scale(sourcePoint, -1));
        final Matrix extrinsic = new Matrix(3, 4);
        extrinsic.setMatrix(0, 2, 0, 2, r);
        for (int row = 0; row < 3; row++) {
            extrinsic.set(row, 3, t[row]);
        }
        return extrinsic;
    }

    private static void checkPositive(final double value,
                                      final String name)
            throws IllegalArgumentException {
        if (! (value > 0)) {
            throw new IllegalArgumentException(name + " must be positive but is " + value);
        }
    }

    private static void checkImagerPixelSpacing(final double[] imagerPixelSpacing)
            throws IllegalArgumentException {
        MatrixUtil.checkVector(imagerPixelSpacing, 2, "imagerPixelSpacing");
        checkPositive(imagerPixelSpacing[0], "imagerPixelSpacing[0]");
        checkPositive(imagerPixelSpacing[1], "imagerPixelSpacing[1]");
    }

    private static final Logger LOG = LoggerFactory.getLogger(CArm.class);
}
