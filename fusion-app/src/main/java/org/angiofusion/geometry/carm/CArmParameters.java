package org.angiofusion.geometry.carm;

import java.io.Reader;
import java.io.Serializable;
import java.util.Arrays;
import java.util.List;

import org.angiofusion.geometry.json.JsonUtils;

/**
 * Acquisition parameters for a C-arm projection, typically decoded from an XA DICOM header:
 * positioner primary/secondary angles (degrees), source to detector and source to patient
 * distances (mm), imager pixel spacing (mm/pixel), detector size and table top offset (mm).
 */
public class CArmParameters
        implements Serializable {

    private final double alpha;
    private final double beta;
    private final double sid;
    private final double sod;
    private final Double sisod;
    private final double[] imagerPixelSpacing;
    private final int rows;
    private final int columns;
    private final double[] tableTopPosition;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private CArmParameters() {
        this(0, 0, 0, 0, null, null, 0, 0, null);
    }

    public CArmParameters(final double alpha,
                          final double beta,
                          final double sid,
                          final double sod,
                          final Double sisod,
                          final double[] imagerPixelSpacing,
                          final int rows,
                          final int columns,
                          final double[] tableTopPosition) {
        this.alpha = alpha;
        this.beta = beta;
        this.sid = sid;
        this.sod = sod;
        this.sisod = sisod;
        this.imagerPixelSpacing = imagerPixelSpacing == null ? null : imagerPixelSpacing.clone();
        this.rows = rows;
        this.columns = columns;
        this.tableTopPosition = tableTopPosition == null ? null : tableTopPosition.clone();
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

    /**
     * @return source to isocenter distance, or null if it defaults to the source to patient distance.
     */
    public Double getSisod() {
        return sisod;
    }

    public double[] getImagerPixelSpacing() {
        return imagerPixelSpacing == null ? null : Arrays.copyOf(imagerPixelSpacing, imagerPixelSpacing.length);
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    /**
     * @return table top offset, or null when the table has not moved.
     */
    public double[] getTableTopPosition() {
        return tableTopPosition == null ? null : Arrays.copyOf(tableTopPosition, tableTopPosition.length);
    }

    /**
     * @return a new C-arm instance built from these parameters (a zero offset is used for a missing table position).
     *
     * @throws IllegalArgumentException
     *   if any parameter is invalid.
     */
    public CArm buildCArm()
            throws IllegalArgumentException {
        final double[] table = tableTopPosition == null ? new double[3] : tableTopPosition;
        return new CArm(alpha, beta, sid, sod, imagerPixelSpacing, rows, columns, table, sisod);
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    @Override
    public String toString() {
        return JsonUtils.FAST_MAPPER.valueToTree(this).toString();
    }

    public static CArmParameters fromJson(final Reader json) {
        return JSON_HELPER.fromJson(json);
    }

    public static List<CArmParameters> fromJsonArray(final Reader json) {
        return JSON_HELPER.fromJsonArray(json);
    }

    /**
     * Converts vendor table top positions (lateral, vertical, longitudinal) into the relative
     * offset used by {@link CArm}. The vertical axis points the other way in the C-arm frame.
     *
     * @return offset as (lateral, -vertical, longitudinal).
     */
    public static double[] tableTopPositionFromDicom(final double lateral,
                                                     final double vertical,
                                                     final double longitudinal) {
        return new double[] { lateral, -vertical, longitudinal };
    }

    private static final JsonUtils.Helper<CArmParameters> JSON_HELPER =
            new JsonUtils.Helper<>(CArmParameters.class);

}
