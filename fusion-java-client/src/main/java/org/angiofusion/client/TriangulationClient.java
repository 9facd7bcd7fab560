package org.angiofusion.client;

import Jama.Matrix;

import com.beust.jcommander.Parameter;

import java.io.Reader;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.angiofusion.client.parameter.CommandLineParameters;
import org.angiofusion.geometry.camera.PinholeCamera;
import org.angiofusion.geometry.carm.CArmFrameAdapter;
import org.angiofusion.geometry.carm.CArmParameters;
import org.angiofusion.geometry.coordinate.CoordinateSystem;
import org.angiofusion.geometry.json.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for reconstructing one 3D point (e.g. a catheter tip or vessel bifurcation)
 * from its location in two or more C-arm views.
 */
public class TriangulationClient {

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--viewsJson",
                description = "JSON file containing an array of views, each with C-arm parameters and one image point",
                required = true)
        public String viewsJson;

        @Parameter(
                names = "--toJson",
                description = "JSON file where the triangulated point is to be stored (.json or .gz)",
                required = true)
        public String toJson;

        @Parameter(
                names = "--coordinateSystem",
                description = "Anatomical coordinate system of the triangulated point")
        public CoordinateSystem coordinateSystem = CoordinateSystem.LPS;

        public void validateInputAndOutput() throws IllegalArgumentException {
            FileUtil.validateReadableFile("--viewsJson", viewsJson);
            FileUtil.validateWritableFile("--toJson", toJson);
        }
    }

    /**
     * One acquisition: the C-arm pose and the image location of the point of interest.
     */
    public static class View
            implements Serializable {

        private final CArmParameters carm;
        private final double[] imagePoint;

        // no-arg constructor needed for JSON deserialization
        @SuppressWarnings("unused")
        private View() {
            this(null, null);
        }

        public View(final CArmParameters carm,
                    final double[] imagePoint) {
            this.carm = carm;
            this.imagePoint = imagePoint;
        }

        public CArmParameters getCarm() {
            return carm;
        }

        public double[] getImagePoint() {
            return imagePoint;
        }

        public static List<View> fromJsonArray(final Reader json) {
            return JSON_HELPER.fromJsonArray(json);
        }

        private static final JsonUtils.Helper<View> JSON_HELPER = new JsonUtils.Helper<>(View.class);
    }

    /**
     * Triangulated point with the pixel distance between each view's image point and its reprojection.
     */
    public static class Result
            implements Serializable {

        private final CoordinateSystem coordinateSystem;
        private final double[] point;
        private final double[] reprojectionErrors;

        // no-arg constructor needed for JSON deserialization
        @SuppressWarnings("unused")
        private Result() {
            this(null, null, null);
        }

        public Result(final CoordinateSystem coordinateSystem,
                      final double[] point,
                      final double[] reprojectionErrors) {
            this.coordinateSystem = coordinateSystem;
            this.point = point;
            this.reprojectionErrors = reprojectionErrors;
        }

        public CoordinateSystem getCoordinateSystem() {
            return coordinateSystem;
        }

        public double[] getPoint() {
            return point;
        }

        public double[] getReprojectionErrors() {
            return reprojectionErrors;
        }
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);
                parameters.validateInputAndOutput();

                LOG.info("runClient: entry, parameters={}", parameters);

                final List<View> views;
                try (final Reader reader = FileUtil.DEFAULT_INSTANCE.getExtensionBasedReader(parameters.viewsJson)) {
                    views = View.fromJsonArray(reader);
                }

                final TriangulationClient client = new TriangulationClient(parameters.coordinateSystem);
                final Result result = client.triangulate(views);

                FileUtil.saveJsonFile(parameters.toJson, result);
            }
        };
        clientRunner.run();
    }

    private final CoordinateSystem coordinateSystem;

    public TriangulationClient(final CoordinateSystem coordinateSystem) {
        this.coordinateSystem = coordinateSystem;
    }

    /**
     * @return point triangulated from the specified views.
     *
     * @throws org.angiofusion.geometry.camera.UnderdeterminedSystemException
     *   if fewer than two views are provided.
     */
    public Result triangulate(final List<View> views)
            throws IllegalArgumentException {

        final List<Matrix> projectionMatrices = new ArrayList<>(views.size());
        final List<double[]> imagePoints = new ArrayList<>(views.size());
        final List<CArmFrameAdapter> geometries = new ArrayList<>(views.size());

        for (int i = 0; i < views.size(); i++) {
            final View view = views.get(i);
            if ((view.getCarm() == null) || (view.getImagePoint() == null)) {
                throw new IllegalArgumentException("view " + i + " must specify carm and imagePoint");
            }
            final CArmFrameAdapter geometry = new CArmFrameAdapter(view.getCarm().buildCArm(), coordinateSystem);
            geometries.add(geometry);
            projectionMatrices.add(geometry.getProjectionMatrix());
            imagePoints.add(view.getImagePoint());
        }

        final double[] point = PinholeCamera.triangulate(projectionMatrices, imagePoints);

        final double[] reprojectionErrors = new double[views.size()];
        for (int i = 0; i < views.size(); i++) {
            final double[] reprojected = geometries.get(i).capture(new double[][] { point })[0];
            final double[] imagePoint = imagePoints.get(i);
            reprojectionErrors[i] = Math.hypot(reprojected[0] - imagePoint[0], reprojected[1] - imagePoint[1]);
        }

        LOG.info("triangulate: point from {} views is {} {}, reprojection errors are {}",
                 views.size(), coordinateSystem, Arrays.toString(point), Arrays.toString(reprojectionErrors));

        return new Result(coordinateSystem, point, reprojectionErrors);
    }

    private static final Logger LOG = LoggerFactory.getLogger(TriangulationClient.class);
}
