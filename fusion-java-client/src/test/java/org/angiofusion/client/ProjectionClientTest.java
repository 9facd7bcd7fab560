package org.angiofusion.client;

import java.io.File;
import java.io.Reader;

import org.angiofusion.client.parameter.CommandLineParameters;
import org.angiofusion.geometry.carm.CArm;
import org.angiofusion.geometry.carm.CArmFrameAdapter;
import org.angiofusion.geometry.coordinate.CoordinateSystem;
import org.angiofusion.geometry.json.JsonUtils;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Tests the {@link ProjectionClient} class.
 */
public class ProjectionClientTest {

    private static final double TOLERANCE = 1e-6;

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    @Test
    public void testParameterParsing() throws Exception {
        CommandLineParameters.parseHelp(new ProjectionClient.Parameters());
    }

    @Test
    public void testProjection() throws Exception {

        final ProjectionClient.Parameters parameters = buildParameters("[[0, 0, 0], [10, -5, 20]]");

        final ProjectionClient client = new ProjectionClient(parameters);
        final double[][] imagePoints = client.mapPoints();

        Assert.assertEquals("invalid number of image points", 2, imagePoints.length);
        Assert.assertArrayEquals("isocenter should project onto the principal point",
                                 new double[] {255.5, 255.5}, imagePoints[0], TOLERANCE);

        final CArmFrameAdapter expectedGeometry =
                CArmFrameAdapter.lps(ClientTestData.buildCArmParameters(30, 45).buildCArm());
        Assert.assertArrayEquals("invalid projection",
                                 expectedGeometry.capture(new double[][] {{10, -5, 20}})[0], imagePoints[1], TOLERANCE);

        final double[][] saved;
        try (final Reader reader = FileUtil.DEFAULT_INSTANCE.getExtensionBasedReader(parameters.toJson)) {
            saved = JsonUtils.pointsFromJson(reader);
        }
        Assert.assertArrayEquals("saved points differ", imagePoints[1], saved[1], TOLERANCE);
    }

    @Test
    public void testBackProjection() throws Exception {

        final ProjectionClient.Parameters parameters = buildParameters("[[255.5, 255.5], [100, 400]]");
        parameters.backProject = true;
        parameters.coordinateSystem = CoordinateSystem.RAS;

        final ProjectionClient client = new ProjectionClient(parameters);
        final double[][] worldPoints = client.mapPoints();

        Assert.assertEquals("client should report geometry in the requested frame",
                            CoordinateSystem.RAS, client.getGeometry().getCoordinateSystem());
        Assert.assertArrayEquals("principal point should back project onto the detector center",
                                 client.getGeometry().getDetectorCenterPoint(), worldPoints[0], TOLERANCE);

        final double[][] projected = client.getGeometry().capture(worldPoints);
        Assert.assertArrayEquals("round trip changed point", new double[] {100, 400}, projected[1], TOLERANCE);
    }

    @Test
    public void testLoadCArm() throws Exception {
        final File carmFile = temporaryFolder.newFile("carm.json");
        ClientTestData.writeFile(carmFile,
                                 "{ \"alpha\": 90, \"beta\": 0, \"sid\": 1000, \"sod\": 750, " +
                                 "\"imagerPixelSpacing\": [0.2, 0.2], \"rows\": 512, \"columns\": 512 }");

        final CArm carm = ProjectionClient.loadCArm(carmFile.getAbsolutePath());
        Assert.assertArrayEquals("missing table position should default to zero",
                                 new double[] {0, 0, 0}, carm.getTableTopPosition(), TOLERANCE);
        Assert.assertArrayEquals("invalid source point",
                                 new double[] {0, -750, 0}, carm.getSourcePoint(), TOLERANCE);
    }

    private ProjectionClient.Parameters buildParameters(final String pointsJson)
            throws Exception {

        final File carmFile = ClientTestData.writeFile(temporaryFolder.newFile("carm.json"),
                                                       ClientTestData.buildCArmParameters(30, 45).toJson());
        final File pointsFile = ClientTestData.writeFile(temporaryFolder.newFile("points.json"), pointsJson);

        final ProjectionClient.Parameters parameters = new ProjectionClient.Parameters();
        parameters.carmJson = carmFile.getAbsolutePath();
        parameters.pointsJson = pointsFile.getAbsolutePath();
        parameters.toJson = new File(temporaryFolder.getRoot(), "mapped.json").getAbsolutePath();
        parameters.validateInputAndOutput();
        return parameters;
    }

}
