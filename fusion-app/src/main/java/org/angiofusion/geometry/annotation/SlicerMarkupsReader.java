package org.angiofusion.geometry.annotation;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.angiofusion.geometry.coordinate.CoordinateSystem;
import org.angiofusion.geometry.coordinate.PatientCoordinates;
import org.angiofusion.geometry.json.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimal reader for 3D Slicer markups documents (.mrk.json) that turns control points
 * (for example a vessel centerline) into LPS point sets.
 * Only the first markup in a document is read.
 *
 * @see <a href="https://github.com/Slicer/Slicer/blob/main/Modules/Loadable/Markups/Resources/Schema/markups-schema-v1.0.3.json">
 *     markups schema</a>
 */
public class SlicerMarkupsReader {

    /** Label prefix of control points marking coronary intervention points. */
    public static final String CIP_LABEL_PREFIX = "cip";

    private final JsonNode markup;

    /**
     * @throws IllegalArgumentException
     *   if the document cannot be parsed, has no markups, or is not expressed in LPS.
     */
    public SlicerMarkupsReader(final Reader json)
            throws IllegalArgumentException {

        final JsonNode root;
        try {
            root = JsonUtils.MAPPER.readTree(json);
        } catch (final IOException e) {
            throw new IllegalArgumentException("failed to parse markups document", e);
        }

        final JsonNode markups = root == null ? null : root.get("markups");
        if ((markups == null) || (! markups.isArray()) || (markups.size() == 0)) {
            throw new IllegalArgumentException("markups document does not contain any markups");
        }

        this.markup = markups.get(0);

        final String coordinateSystem = getCoordinateSystem();
        if (! isLps(coordinateSystem)) {
            throw new IllegalArgumentException("markups coordinate system must be LPS but is " + coordinateSystem);
        }
    }

    public String getCoordinateSystem() {
        return markup.path("coordinateSystem").asText(null);
    }

    public String getCoordinateUnits() {
        return markup.path("coordinateUnits").asText(null);
    }

    /**
     * @return all control point positions, or null if the markup has no control points.
     */
    public PatientCoordinates getControlPoints() {
        final JsonNode controlPoints = markup.get("controlPoints");
        if (controlPoints == null) {
            return null;
        }
        final List<double[]> positions = new ArrayList<>();
        for (final JsonNode controlPoint : controlPoints) {
            positions.add(readPosition(controlPoint));
        }
        return toCoordinates(positions);
    }

    /**
     * @return control point positions keyed by label in document order, or null if there are no control points.
     */
    public Map<String, PatientCoordinates> getControlPointsWithLabel() {
        final JsonNode controlPoints = markup.get("controlPoints");
        if (controlPoints == null) {
            return null;
        }
        final Map<String, PatientCoordinates> labeledPoints = new LinkedHashMap<>();
        for (final JsonNode controlPoint : controlPoints) {
            labeledPoints.put(controlPoint.path("label").asText(),
                              PatientCoordinates.ofPoint(readPosition(controlPoint), CoordinateSystem.LPS));
        }
        return labeledPoints;
    }

    /**
     * @return positions of control points whose label starts with {@link #CIP_LABEL_PREFIX} (possibly empty).
     */
    public PatientCoordinates getCipPoints() {
        final List<double[]> positions = new ArrayList<>();
        final JsonNode controlPoints = markup.get("controlPoints");
        if (controlPoints != null) {
            for (final JsonNode controlPoint : controlPoints) {
                if (controlPoint.path("label").asText("").startsWith(CIP_LABEL_PREFIX)) {
                    positions.add(readPosition(controlPoint));
                }
            }
        }
        LOG.debug("getCipPoints: found {} points", positions.size());
        return toCoordinates(positions);
    }

    static boolean isLps(final String coordinateSystem) {
        return "LPS".equals(coordinateSystem) || "left-posterior-superior".equals(coordinateSystem);
    }

    private static double[] readPosition(final JsonNode controlPoint)
            throws IllegalArgumentException {
        final JsonNode position = controlPoint.get("position");
        if ((position == null) || (! position.isArray()) || (position.size() != 3)) {
            throw new IllegalArgumentException("control point " + controlPoint.path("label").asText() +
                                               " does not have a 3D position");
        }
        return new double[] { position.get(0).asDouble(), position.get(1).asDouble(), position.get(2).asDouble() };
    }

    private static PatientCoordinates toCoordinates(final List<double[]> positions) {
        return new PatientCoordinates(positions.toArray(new double[0][]), CoordinateSystem.LPS);
    }

    private static final Logger LOG = LoggerFactory.getLogger(SlicerMarkupsReader.class);
}
