package org.angiofusion.client;

import com.beust.jcommander.Parameter;

import java.io.IOException;
import java.io.Reader;

import org.angiofusion.client.parameter.CommandLineParameters;
import org.angiofusion.geometry.carm.CArm;
import org.angiofusion.geometry.carm.CArmFrameAdapter;
import org.angiofusion.geometry.carm.CArmParameters;
import org.angiofusion.geometry.coordinate.CoordinateSystem;
import org.angiofusion.geometry.json.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for projecting 3D patient points onto the detector of a C-arm
 * or for back projecting detector points into patient space.
 */
public class ProjectionClient {

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--carmJson",
                description = "JSON file containing C-arm acquisition parameters (alpha, beta, sid, sod, ...)",
                required = true)
        public String carmJson;

        @Parameter(
                names = "--pointsJson",
                description = "JSON file containing an array of points ([[x, y, z], ...] or [[u, v], ...] for --backProject)",
                required = true)
        public String pointsJson;

        @Parameter(
                names = "--toJson",
                description = "JSON file where mapped points are to be stored (.json or .gz)",
                required = true)
        public String toJson;

        @Parameter(
                names = "--coordinateSystem",
                description = "Anatomical coordinate system of the 3D points")
        public CoordinateSystem coordinateSystem = CoordinateSystem.LPS;

        @Parameter(
                names = "--backProject",
                description = "Map 2D image points onto the detector plane in 3D (default is to project 3D points to 2D)",
                arity = 0)
        public boolean backProject = false;

        public void validateInputAndOutput() throws IllegalArgumentException {
            FileUtil.validateReadableFile("--carmJson", carmJson);
            FileUtil.validateReadableFile("--pointsJson", pointsJson);
            FileUtil.validateWritableFile("--toJson", toJson);
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

                final ProjectionClient client = new ProjectionClient(parameters);
                client.mapPoints();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;
    private final CArmFrameAdapter geometry;

    public ProjectionClient(final Parameters parameters)
            throws IOException {
        this.parameters = parameters;
        this.geometry = new CArmFrameAdapter(loadCArm(parameters.carmJson), parameters.coordinateSystem);
    }

    public CArmFrameAdapter getGeometry() {
        return geometry;
    }

    /**
     * Loads the input points, maps them in the configured direction and saves the result.
     *
     * @return the mapped points.
     */
    public double[][] mapPoints()
            throws IOException {

        final double[][] points;
        try (final Reader reader = FileUtil.DEFAULT_INSTANCE.getExtensionBasedReader(parameters.pointsJson)) {
            points = JsonUtils.pointsFromJson(reader);
        }

        LOG.info("mapPoints: loaded {} points from {}", points.length, parameters.pointsJson);

        final double[][] mappedPoints;
        if (parameters.backProject) {
            mappedPoints = geometry.imageToWorld(points);
        } else {
            mappedPoints = geometry.capture(points);
        }

        FileUtil.saveJsonFile(parameters.toJson, mappedPoints);

        return mappedPoints;
    }

    static CArm loadCArm(final String path)
            throws IOException {
        final CArmParameters carmParameters;
        try (final Reader reader = FileUtil.DEFAULT_INSTANCE.getExtensionBasedReader(path)) {
            carmParameters = CArmParameters.fromJson(reader);
        }
        LOG.info("loadCArm: loaded {}", carmParameters);
        return carmParameters.buildCArm();
    }

    private static final Logger LOG = LoggerFactory.getLogger(ProjectionClient.class);
}
