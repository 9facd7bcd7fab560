package org.angiofusion.geometry.volume;

import java.io.Reader;
import java.io.Serializable;
import java.util.Arrays;
import java.util.List;

import org.angiofusion.geometry.json.JsonUtils;

/**
 * Decoded geometry attributes of one image slice in a CT (or other volumetric) series.
 * Optional attributes are null when the source header does not contain them.
 */
public class SliceGeometry
        implements Serializable {

    private final String sopInstanceUid;
    private final int rows;
    private final int columns;
    private final double[] pixelSpacing;
    private final double[] imageOrientationPatient;
    private final double[] imagePositionPatient;
    private final Double sliceLocation;
    private final Double sliceThickness;
    private final Double spacingBetweenSlices;
    private final String anatomicalOrientationType;
    private final String patientPosition;
    private final String seriesDescription;
    private final Double tableHeight;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private SliceGeometry() {
        this(null, 0, 0, null, null, null, null, null, null, null, null, null, null);
    }

    /**
     * Constructs a slice with only the attributes needed for spatial addressing.
     */
    public SliceGeometry(final int rows,
                         final int columns,
                         final double[] pixelSpacing,
                         final double[] imageOrientationPatient,
                         final double[] imagePositionPatient,
                         final Double sliceLocation,
                         final Double sliceThickness,
                         final Double spacingBetweenSlices) {
        this(null, rows, columns, pixelSpacing, imageOrientationPatient, imagePositionPatient,
             sliceLocation, sliceThickness, spacingBetweenSlices, null, null, null, null);
    }

    /**
     * @param  sopInstanceUid             SOP Instance UID (0008,0018).
     * @param  rows                       Rows (0028,0010).
     * @param  columns                    Columns (0028,0011).
     * @param  pixelSpacing               Pixel Spacing (0028,0030) as (row spacing, column spacing) in mm;
     *                                    a single value applies to both.
     * @param  imageOrientationPatient    Image Orientation (Patient) (0020,0037): row then column direction cosines.
     * @param  imagePositionPatient       Image Position (Patient) (0020,0032): center of the first voxel in mm.
     * @param  sliceLocation              Slice Location (0020,1041).
     * @param  sliceThickness             Slice Thickness (0018,0050).
     * @param  spacingBetweenSlices       Spacing Between Slices (0018,0088).
     * @param  anatomicalOrientationType  Anatomical Orientation Type (0010,2210).
     * @param  patientPosition            Patient Position (0018,5100).
     * @param  seriesDescription          Series Description (0008,103E).
     * @param  tableHeight                Table Height (0018,1130).
     */
    public SliceGeometry(final String sopInstanceUid,
                         final int rows,
                         final int columns,
                         final double[] pixelSpacing,
                         final double[] imageOrientationPatient,
                         final double[] imagePositionPatient,
                         final Double sliceLocation,
                         final Double sliceThickness,
                         final Double spacingBetweenSlices,
                         final String anatomicalOrientationType,
                         final String patientPosition,
                         final String seriesDescription,
                         final Double tableHeight) {
        this.sopInstanceUid = sopInstanceUid;
        this.rows = rows;
        this.columns = columns;
        this.pixelSpacing = pixelSpacing == null ? null : pixelSpacing.clone();
        this.imageOrientationPatient = imageOrientationPatient == null ? null : imageOrientationPatient.clone();
        this.imagePositionPatient = imagePositionPatient == null ? null : imagePositionPatient.clone();
        this.sliceLocation = sliceLocation;
        this.sliceThickness = sliceThickness;
        this.spacingBetweenSlices = spacingBetweenSlices;
        this.anatomicalOrientationType = anatomicalOrientationType;
        this.patientPosition = patientPosition;
        this.seriesDescription = seriesDescription;
        this.tableHeight = tableHeight;
    }

    public String getSopInstanceUid() {
        return sopInstanceUid;
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    /**
     * @return (row spacing, column spacing) in mm, or null if not defined.
     */
    public double[] getPixelSpacing() {
        if ((pixelSpacing == null) || (pixelSpacing.length == 0)) {
            return null;
        } else if (pixelSpacing.length == 1) {
            return new double[] { pixelSpacing[0], pixelSpacing[0] };
        }
        return Arrays.copyOf(pixelSpacing, 2);
    }

    public double[] getImageOrientationPatient() {
        return copyOrNull(imageOrientationPatient, 6);
    }

    public double[] getImagePositionPatient() {
        return copyOrNull(imagePositionPatient, 3);
    }

    public Double getSliceLocation() {
        return sliceLocation;
    }

    public Double getSliceThickness() {
        return sliceThickness;
    }

    public Double getSpacingBetweenSlices() {
        return spacingBetweenSlices;
    }

    public String getAnatomicalOrientationType() {
        return anatomicalOrientationType;
    }

    public String getPatientPosition() {
        return patientPosition;
    }

    public String getSeriesDescription() {
        return seriesDescription;
    }

    public Double getTableHeight() {
        return tableHeight;
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    @Override
    public String toString() {
        return JsonUtils.FAST_MAPPER.valueToTree(this).toString();
    }

    public static List<SliceGeometry> fromJsonArray(final Reader json) {
        return JSON_HELPER.fromJsonArray(json);
    }

    private static double[] copyOrNull(final double[] values,
                                       final int expectedLength) {
        if (values == null) {
            return null;
        } else if (values.length != expectedLength) {
            throw new IllegalArgumentException("expected " + expectedLength + " values but found " + values.length);
        }
        return Arrays.copyOf(values, expectedLength);
    }

    private static final JsonUtils.Helper<SliceGeometry> JSON_HELPER =
            new JsonUtils.Helper<>(SliceGeometry.class);

}
