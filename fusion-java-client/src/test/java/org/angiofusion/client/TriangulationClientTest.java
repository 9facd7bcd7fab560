package org.angiofusion.client;

import java.io.File;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.angiofusion.client.parameter.CommandLineParameters;
import org.angiofusion.geometry.camera.UnderdeterminedSystemException;
import org.angiofusion.geometry.carm.CArmFrameAdapter;
import org.angiofusion.geometry.carm.CArmParameters;
import org.angiofusion.geometry.coordinate.CoordinateSystem;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Tests the {@link TriangulationClient} class.
 */
public class TriangulationClientTest {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    @Test
    public void testParameterParsing() throws Exception {
        CommandLineParameters.parseHelp(new TriangulationClient.Parameters());
    }

    @Test
    public void testTriangulation() throws Exception {

        final double[] expected = {12.0, -8.0, 25.0};
        final List<TriangulationClient.View> views = buildViews(expected,
                                                                new double[][] {{30, 20}, {-45, 10}, {0, -25}});

        final TriangulationClient client = new TriangulationClient(CoordinateSystem.LPS);
        final TriangulationClient.Result result = client.triangulate(views);

        Assert.assertEquals("invalid coordinate system", CoordinateSystem.LPS, result.getCoordinateSystem());
        Assert.assertArrayEquals("invalid triangulated point", expected, result.getPoint(), 1e-4);
        for (final double error : result.getReprojectionErrors()) {
            Assert.assertEquals("reprojection error should vanish for exact views", 0, error, 1e-4);
        }
    }

    @Test
    public void testViewsFromJson() throws Exception {

        final double[] expected = {-5.0, 3.0, 40.0};
        final List<TriangulationClient.View> views = buildViews(expected, new double[][] {{20, 0}, {-20, 15}});

        final File viewsFile = temporaryFolder.newFile("views.json");
        FileUtil.saveJsonFile(viewsFile.getAbsolutePath(), views);

        final List<TriangulationClient.View> loadedViews;
        try (final Reader reader = FileUtil.DEFAULT_INSTANCE.getExtensionBasedReader(viewsFile.getAbsolutePath())) {
            loadedViews = TriangulationClient.View.fromJsonArray(reader);
        }

        final TriangulationClient.Result result = new TriangulationClient(CoordinateSystem.LPS).triangulate(loadedViews);
        Assert.assertArrayEquals("invalid triangulated point", expected, result.getPoint(), 1e-4);

        final File resultFile = new File(temporaryFolder.getRoot(), "result.json");
        FileUtil.saveJsonFile(resultFile.getAbsolutePath(), result);
        final String resultJson = new String(Files.readAllBytes(resultFile.toPath()), StandardCharsets.UTF_8);
        Assert.assertTrue("result should name its coordinate system", resultJson.contains("\"LPS\""));
    }

    @Test(expected = UnderdeterminedSystemException.class)
    public void testSingleView() {
        final List<TriangulationClient.View> views = buildViews(new double[] {0, 0, 0}, new double[][] {{0, 0}});
        new TriangulationClient(CoordinateSystem.LPS).triangulate(views);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testIncompleteView() {
        final String json = "[ { \"imagePoint\": [1, 2] }, { \"imagePoint\": [3, 4] } ]";
        final List<TriangulationClient.View> views = TriangulationClient.View.fromJsonArray(new StringReader(json));
        new TriangulationClient(CoordinateSystem.LPS).triangulate(views);
    }

    @Test
    public void testEmptyViewList() {
        try {
            new TriangulationClient(CoordinateSystem.LPS).triangulate(Collections.emptyList());
            Assert.fail("empty view list should be rejected");
        } catch (final UnderdeterminedSystemException e) {
            Assert.assertNotNull("exception should have a message", e.getMessage());
        }
    }

    private static List<TriangulationClient.View> buildViews(final double[] lpsPoint,
                                                             final double[][] angles) {
        final List<TriangulationClient.View> views = new ArrayList<>();
        for (final double[] alphaBeta : angles) {
            final CArmParameters carmParameters = ClientTestData.buildCArmParameters(alphaBeta[0], alphaBeta[1]);
            final CArmFrameAdapter geometry = CArmFrameAdapter.lps(carmParameters.buildCArm());
            final double[] imagePoint = geometry.capture(new double[][] { lpsPoint })[0];
            views.add(new TriangulationClient.View(carmParameters, imagePoint));
        }
        return views;
    }

}
