package org.angiofusion.geometry.volume;

import Jama.Matrix;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.angiofusion.geometry.coordinate.CoordinateSystem;
import org.angiofusion.geometry.coordinate.PatientCoordinates;
import org.angiofusion.geometry.coordinate.PatientPosition;
import org.angiofusion.geometry.gating.GatingDelay;
import org.angiofusion.geometry.util.DegenerateGeometryException;
import org.angiofusion.geometry.util.MatrixUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Spatial layout of a stack of slices: ordering, spacing and the mapping from voxel indices
 * to DICOM RCS (patient, LPS) coordinates.
 *
 * <p>
 * Slices are sorted in ascending order of Slice Location, falling back to the z component of
 * Image Position (Patient) and then to their original order. All slices must share rows, columns,
 * pixel spacing and orientation. Only the first slice (after sorting) is consulted for series level
 * attributes such as spacing between slices, patient position or anatomical orientation type.
 * </p>
 *
 * <p>
 * Instances are immutable except for the voxel stack, which is assembled on first request
 * and then reused for the lifetime of the instance.
 * </p>
 *
 * @see <a href="https://dicom.nema.org/medical/dicom/current/output/chtml/part03/sect_C.7.6.2.html#sect_C.7.6.2.1.1">
 *     Image Position and Image Orientation (C.7.6.2.1.1)</a>
 */
public class VolumeGeometry {

    /** Tolerance for comparing geometry attributes that must be shared by all slices. */
    public static final double SHARED_GEOMETRY_TOLERANCE = 1e-4;

    private final List<SliceGeometry> slices;
    private final SliceGeometry referenceSlice;
    private final SlicePixelLoader pixelLoader;

    private short[] voxelStack;

    public VolumeGeometry(final List<SliceGeometry> unsortedSlices)
            throws IllegalArgumentException {
        this(unsortedSlices, null);
    }

    /**
     * @param  unsortedSlices  slices in acquisition (or arbitrary) order.
     * @param  pixelLoader     source of pixel data for {@link #getVoxelStack()} (may be null).
     *
     * @throws IllegalArgumentException
     *   if no slices are provided, the slices do not share their in-plane geometry,
     *   a defined spacing is not positive, or the positions are not monotonic along the slice normal.
     */
    public VolumeGeometry(final List<SliceGeometry> unsortedSlices,
                          final SlicePixelLoader pixelLoader)
            throws IllegalArgumentException {

        if ((unsortedSlices == null) || unsortedSlices.isEmpty()) {
            throw new IllegalArgumentException("volume must contain at least one slice");
        }

        this.slices = Collections.unmodifiableList(sortSlices(unsortedSlices));
        this.referenceSlice = this.slices.get(0);
        this.pixelLoader = pixelLoader;
        this.voxelStack = null;

        validateSharedGeometry();
        validateSpacing();
        validateMonotonicPositions();

        LOG.debug("VolumeGeometry: sorted {} slices of {}x{} pixels",
                  slices.size(), referenceSlice.getColumns(), referenceSlice.getRows());
    }

    /**
     * Orders slices by Slice Location, else by the z component of Image Position (Patient), else by original index.
     * The sort is stable, so ties keep their original order.
     *
     * @return new sorted list.
     */
    public static List<SliceGeometry> sortSlices(final List<SliceGeometry> unsortedSlices) {

        final List<SortKey> keys = new ArrayList<>(unsortedSlices.size());
        for (int i = 0; i < unsortedSlices.size(); i++) {
            keys.add(new SortKey(unsortedSlices.get(i), i));
        }

        keys.sort(Comparator.comparingDouble((SortKey k) -> k.position).thenComparingInt(k -> k.originalIndex));

        final List<SliceGeometry> sortedSlices = new ArrayList<>(keys.size());
        for (final SortKey key : keys) {
            sortedSlices.add(key.slice);
        }
        return sortedSlices;
    }

    public List<SliceGeometry> getSlices() {
        return slices;
    }

    public SliceGeometry getSlice(final int index) {
        return slices.get(index);
    }

    public int getNumberOfSlices() {
        return slices.size();
    }

    public int getRows() {
        return referenceSlice.getRows();
    }

    public int getColumns() {
        return referenceSlice.getColumns();
    }

    /**
     * @return (columns, rows, slices).
     */
    public int[] getDimensions() {
        return new int[] { getColumns(), getRows(), getNumberOfSlices() };
    }

    public AnatomicalOrientationType getAnatomicalOrientationType() {
        return AnatomicalOrientationType.fromDicomValue(referenceSlice.getAnatomicalOrientationType());
    }

    /**
     * @return patient position of the series, or null if the attribute is absent.
     *
     * @throws IllegalArgumentException
     *   if the position is not one of the supported {@link PatientPosition} values.
     */
    public PatientPosition getPatientPosition()
            throws IllegalArgumentException {
        final String value = referenceSlice.getPatientPosition();
        if ((value == null) || value.trim().isEmpty()) {
            return null;
        }
        try {
            return PatientPosition.valueOf(value.trim().toUpperCase());
        } catch (final IllegalArgumentException e) {
            throw new IllegalArgumentException("unsupported patient position '" + value + "'", e);
        }
    }

    public Double getTableHeight() {
        return referenceSlice.getTableHeight();
    }

    /**
     * @return reconstruction phase parsed from the series description (e.g. 0.75 for "75%"), or null.
     */
    public Double getGatingDelay() {
        return GatingDelay.parse(referenceSlice.getSeriesDescription());
    }

    /**
     * @return (row spacing, column spacing) in mm.
     *
     * @throws MissingGeometryException
     *   if Pixel Spacing is not defined.
     */
    public double[] getPixelSpacing()
            throws MissingGeometryException {
        final double[] pixelSpacing = referenceSlice.getPixelSpacing();
        if (pixelSpacing == null) {
            throw MissingGeometryException.forSlice("PixelSpacing", 0);
        }
        return pixelSpacing;
    }

    /**
     * @return (row spacing, column spacing, spacing between slices) in mm, where spacing between slices
     *         is Spacing Between Slices when present and Slice Thickness otherwise.
     *
     * @throws MissingSpacingException
     *   if neither inter-slice attribute is defined.
     */
    public double[] getSpacing()
            throws MissingGeometryException {

        final double[] pixelSpacing = getPixelSpacing();

        final Double sliceSpacing;
        if (referenceSlice.getSpacingBetweenSlices() != null) {
            sliceSpacing = referenceSlice.getSpacingBetweenSlices();
        } else if (referenceSlice.getSliceThickness() != null) {
            sliceSpacing = referenceSlice.getSliceThickness();
        } else {
            throw new MissingSpacingException();
        }

        return new double[] { pixelSpacing[0], pixelSpacing[1], sliceSpacing };
    }

    /**
     * @return row direction cosines followed by column direction cosines.
     *
     * @throws MissingGeometryException
     *   if Image Orientation (Patient) is not defined.
     */
    public double[] getImageOrientationPatient()
            throws MissingGeometryException {
        final double[] orientation = referenceSlice.getImageOrientationPatient();
        if (orientation == null) {
            throw MissingGeometryException.forSlice("ImageOrientationPatient", 0);
        }
        return orientation;
    }

    /**
     * @return unit normal of the slice planes (row cosine x column cosine).
     *
     * @throws DegenerateGeometryException
     *   if the row and column cosines are parallel or zero.
     */
    public double[] getSliceNormal()
            throws MissingGeometryException, DegenerateGeometryException {
        final double[] orientation = getImageOrientationPatient();
        final double[] normal = MatrixUtil.cross(Arrays.copyOfRange(orientation, 0, 3),
                                                 Arrays.copyOfRange(orientation, 3, 6));
        final double length = MatrixUtil.norm(normal);
        if (length < MatrixUtil.SINGULAR_TOLERANCE) {
            throw new DegenerateGeometryException("image orientation " + Arrays.toString(orientation) +
                                                  " does not define a slice normal");
        }
        return MatrixUtil.scale(normal, 1 / length);
    }

    /**
     * @return 3x3 direction matrix whose columns are the row cosine, column cosine and slice normal.
     */
    public Matrix getDirectionMatrix()
            throws MissingGeometryException, DegenerateGeometryException {
        final double[] orientation = getImageOrientationPatient();
        final double[] normal = getSliceNormal();
        final Matrix direction = new Matrix(3, 3);
        for (int row = 0; row < 3; row++) {
            direction.set(row, 0, orientation[row]);
            direction.set(row, 1, orientation[3 + row]);
            direction.set(row, 2, normal[row]);
        }
        return direction;
    }

    /**
     * @return Image Position (Patient) of the first sorted slice.
     */
    public double[] getOrigin()
            throws MissingGeometryException, UnsupportedOrientationException {
        return getImagePositionPatient(0);
    }

    /**
     * Returns the patient space position of the first voxel of a (possibly fractional) slice index.
     * For index n + f with 0 &lt; f &lt; 1 the position is linearly interpolated between slices n and n + 1.
     * Past the last slice the last inter-slice step is extrapolated
     * (for a single slice volume the step is the slice spacing along the normal).
     *
     * @param  sliceIndex  slice index in [0, number of slices).
     *
     * @return position in mm (RCS).
     *
     * @throws UnsupportedOrientationException
     *   for QUADRUPED volumes.
     *
     * @throws MissingGeometryException
     *   if a required position is not defined.
     */
    public double[] getImagePositionPatient(final double sliceIndex)
            throws MissingGeometryException, UnsupportedOrientationException, IllegalArgumentException {

        final AnatomicalOrientationType orientationType = getAnatomicalOrientationType();
        if (orientationType == AnatomicalOrientationType.QUADRUPED) {
            throw new UnsupportedOrientationException(orientationType);
        }

        final int wholeIndex = (int) Math.floor(sliceIndex);
        final double fraction = sliceIndex - wholeIndex;
        if ((wholeIndex < 0) || (wholeIndex >= slices.size()) || Double.isNaN(sliceIndex)) {
            throw new IllegalArgumentException("slice index " + sliceIndex + " is outside of [0, " +
                                               slices.size() + ")");
        }

        final double[] position = getPosition(wholeIndex);
        if (fraction == 0) {
            return position;
        }

        final double[] step;
        if (wholeIndex + 1 < slices.size()) {
            step = MatrixUtil.subtract(getPosition(wholeIndex + 1), position);
        } else if (wholeIndex > 0) {
            step = MatrixUtil.subtract(position, getPosition(wholeIndex - 1));
        } else {
            step = MatrixUtil.scale(getSliceNormal(), getSpacing()[2]);
        }

        return MatrixUtil.add(position, MatrixUtil.scale(step, fraction));
    }

    /**
     * Builds the affine of equation C.7.6.2.1-1 for a slice:
     * <pre>
     *     [ X_xx * dj   Y_xx * di   0   S_x ]
     *     [ X_xy * dj   Y_xy * di   0   S_y ]
     *     [ X_xz * dj   Y_xz * di   0   S_z ]
     * </pre>
     * where X and Y are the row and column direction cosines, di and dj the row and column
     * pixel spacing and S the (interpolated) image position.
     *
     * @return 3x4 matrix mapping (x, y, 0, 1) to RCS coordinates.
     */
    public Matrix getVoxelToRcsMatrix(final double sliceIndex)
            throws MissingGeometryException, UnsupportedOrientationException {

        final double[] orientation = getImageOrientationPatient();
        final double[] pixelSpacing = getPixelSpacing();
        final double[] position = getImagePositionPatient(sliceIndex);

        final Matrix m = new Matrix(3, 4);
        for (int row = 0; row < 3; row++) {
            m.set(row, 0, orientation[row] * pixelSpacing[1]);
            m.set(row, 1, orientation[3 + row] * pixelSpacing[0]);
            m.set(row, 3, position[row]);
        }
        return m;
    }

    /**
     * @param  voxel  (column index, row index, slice index); the slice index may be fractional.
     *
     * @return RCS (LPS) coordinates in mm.
     */
    public double[] voxelToRcs(final double[] voxel)
            throws MissingGeometryException, UnsupportedOrientationException {
        MatrixUtil.checkVector(voxel, 3, "voxel");
        return MatrixUtil.times(getVoxelToRcsMatrix(voxel[2]), new double[] { voxel[0], voxel[1], 0, 1 });
    }

    /**
     * @return voxel center as ((columns - 1) / 2, (rows - 1) / 2, slices / 2).
     */
    public double[] getVolumeCenterVoxel() {
        return new double[] {
                (getColumns() - 1) / 2.0,
                (getRows() - 1) / 2.0,
                getNumberOfSlices() / 2.0
        };
    }

    /**
     * @return physical (RCS) position of {@link #getVolumeCenterVoxel()} in mm.
     */
    public double[] getVolumeCenterPosition()
            throws MissingGeometryException, UnsupportedOrientationException {
        return voxelToRcs(getVolumeCenterVoxel());
    }

    /**
     * @return physical volume center tagged as an LPS point.
     */
    public PatientCoordinates getVolumeCenter()
            throws MissingGeometryException, UnsupportedOrientationException {
        return PatientCoordinates.ofPoint(getVolumeCenterPosition(), CoordinateSystem.LPS);
    }

    /**
     * Assembles (once) the pixel data of all slices in sorted order.
     * Columns vary fastest, then rows, then slices.
     * The returned array is shared by all callers and must not be modified.
     *
     * @throws IllegalStateException
     *   if this volume was constructed without a pixel loader or a slice has the wrong number of pixels.
     *
     * @throws IOException
     *   if pixels cannot be loaded.
     */
    public short[] getVoxelStack()
            throws IllegalStateException, IOException {

        if (voxelStack == null) {

            if (pixelLoader == null) {
                throw new IllegalStateException("no pixel loader was provided for this volume");
            }

            final long voxelCount = (long) getRows() * getColumns() * slices.size();
            if (voxelCount > Integer.MAX_VALUE) {
                throw new IllegalStateException("volume has " + voxelCount + " voxels which exceeds the " +
                                                Integer.MAX_VALUE + " voxel limit of a single stack");
            }

            final int pixelsPerSlice = getRows() * getColumns();
            final short[] stack = new short[(int) voxelCount];
            for (int i = 0; i < slices.size(); i++) {
                final short[] pixels = pixelLoader.loadPixels(slices.get(i));
                if ((pixels == null) || (pixels.length != pixelsPerSlice)) {
                    throw new IllegalStateException("slice " + i + " should have " + pixelsPerSlice + " pixels but has " +
                                                    (pixels == null ? 0 : pixels.length));
                }
                System.arraycopy(pixels, 0, stack, i * pixelsPerSlice, pixelsPerSlice);
            }

            LOG.debug("getVoxelStack: assembled {} voxels", stack.length);

            voxelStack = stack;
        }

        return voxelStack;
    }

    @Override
    public String toString() {
        return "{ \"slices\": " + slices.size() +
               ", \"rows\": " + getRows() +
               ", \"columns\": " + getColumns() +
               '}';
    }

    private double[] getPosition(final int sliceIndex)
            throws MissingGeometryException {
        final double[] position = slices.get(sliceIndex).getImagePositionPatient();
        if (position == null) {
            throw MissingGeometryException.forSlice("ImagePositionPatient", sliceIndex);
        }
        return position;
    }

    private void validateSpacing()
            throws IllegalArgumentException {
        final double[] pixelSpacing = referenceSlice.getPixelSpacing();
        if (pixelSpacing != null) {
            checkPositive(pixelSpacing[0], "PixelSpacing row spacing");
            checkPositive(pixelSpacing[1], "PixelSpacing column spacing");
        }
        if (referenceSlice.getSliceThickness() != null) {
            checkPositive(referenceSlice.getSliceThickness(), "SliceThickness");
        }
        if (referenceSlice.getSpacingBetweenSlices() != null) {
            checkPositive(referenceSlice.getSpacingBetweenSlices(), "SpacingBetweenSlices");
        }
    }

    private static void checkPositive(final double value,
                                      final String name)
            throws IllegalArgumentException {
        if (! (value > 0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(name + " must be a positive finite value but is " + value);
        }
    }

    private void validateSharedGeometry()
            throws IllegalArgumentException {

        if ((getRows() <= 0) || (getColumns() <= 0)) {
            throw new IllegalArgumentException("rows and columns must be positive but are " +
                                               getRows() + " and " + getColumns());
        }

        final double[] pixelSpacing = referenceSlice.getPixelSpacing();
        final double[] orientation = referenceSlice.getImageOrientationPatient();

        for (int i = 1; i < slices.size(); i++) {
            final SliceGeometry slice = slices.get(i);
            if ((slice.getRows() != getRows()) || (slice.getColumns() != getColumns())) {
                throw new IllegalArgumentException("slice " + i + " has " + slice.getColumns() + "x" + slice.getRows() +
                                                   " pixels but slice 0 has " + getColumns() + "x" + getRows());
            }
            if (! isSame(pixelSpacing, slice.getPixelSpacing())) {
                throw new IllegalArgumentException("slice " + i + " pixel spacing differs from slice 0");
            }
            if (! isSame(orientation, slice.getImageOrientationPatient())) {
                throw new IllegalArgumentException("slice " + i + " orientation differs from slice 0");
            }
        }
    }

    private void validateMonotonicPositions()
            throws IllegalArgumentException, DegenerateGeometryException {

        if ((slices.size() < 2) || (referenceSlice.getImageOrientationPatient() == null)) {
            return;
        }

        for (final SliceGeometry slice : slices) {
            if (slice.getImagePositionPatient() == null) {
                return;
            }
        }

        final double[] normal = getSliceNormal();
        boolean increasing = false;
        boolean decreasing = false;
        double previous = dot(normal, slices.get(0).getImagePositionPatient());
        for (int i = 1; i < slices.size(); i++) {
            final double current = dot(normal, slices.get(i).getImagePositionPatient());
            if (current - previous > SHARED_GEOMETRY_TOLERANCE) {
                increasing = true;
            } else if (previous - current > SHARED_GEOMETRY_TOLERANCE) {
                decreasing = true;
            }
            previous = current;
        }

        if (increasing && decreasing) {
            throw new IllegalArgumentException("slice positions are not monotonic along the slice normal after sorting");
        }
    }

    private static double dot(final double[] a,
                              final double[] b) {
        return a[0] * b[0] + a[1] * b[1] + a[2] * b[2];
    }

    private static boolean isSame(final double[] a,
                                  final double[] b) {
        if ((a == null) || (b == null)) {
            return a == b;
        }
        if (a.length != b.length) {
            return false;
        }
        for (int i = 0; i < a.length; i++) {
            if (Math.abs(a[i] - b[i]) > SHARED_GEOMETRY_TOLERANCE) {
                return false;
            }
        }
        return true;
    }

    private static class SortKey {

        private final SliceGeometry slice;
        private final int originalIndex;
        private final double position;

        SortKey(final SliceGeometry slice,
                final int originalIndex) {
            this.slice = slice;
            this.originalIndex = originalIndex;
            final double[] imagePosition = slice.getImagePositionPatient();
            if (slice.getSliceLocation() != null) {
                this.position = slice.getSliceLocation();
            } else if (imagePosition != null) {
                this.position = imagePosition[2];
            } else {
                this.position = originalIndex;
            }
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(VolumeGeometry.class);
}
