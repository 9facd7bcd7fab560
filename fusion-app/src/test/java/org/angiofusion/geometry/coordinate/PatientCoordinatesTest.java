package org.angiofusion.geometry.coordinate;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link PatientCoordinates} class.
 */
public class PatientCoordinatesTest {

    private static final double TOLERANCE = 1e-9;

    @Test
    public void testToCoordinateSystem() {
        final PatientCoordinates lps = new PatientCoordinates(new double[][] {{1, 2, 3}, {-4, 5, -6}},
                                                              CoordinateSystem.LPS);

        final PatientCoordinates ras = lps.toCoordinateSystem(CoordinateSystem.RAS);
        Assert.assertEquals("invalid system", CoordinateSystem.RAS, ras.getCoordinateSystem());
        Assert.assertArrayEquals("invalid point 0", new double[] {-1, -2, 3}, ras.getPoint(0), TOLERANCE);
        Assert.assertArrayEquals("invalid point 1", new double[] {4, -5, -6}, ras.getPoint(1), TOLERANCE);

        final PatientCoordinates ila = lps.toCoordinateSystem(CoordinateSystem.ILA);
        final PatientCoordinates backToLps = ila.toCoordinateSystem(CoordinateSystem.LPS);
        for (int i = 0; i < lps.size(); i++) {
            Assert.assertArrayEquals("round trip through ILA changed point " + i,
                                     lps.getPoint(i), backToLps.getPoint(i), TOLERANCE);
        }
    }

    @Test
    public void testToWorld() {
        final PatientCoordinates lps = PatientCoordinates.ofPoint(new double[] {1, 2, 3}, CoordinateSystem.LPS);

        final PatientCoordinates headFirst = lps.toWorld(PatientPosition.HFS);
        Assert.assertEquals("world points should be ILA", CoordinateSystem.ILA, headFirst.getCoordinateSystem());
        Assert.assertArrayEquals("invalid HFS world point", new double[] {-3, 1, -2}, headFirst.getPoint(0), TOLERANCE);

        final PatientCoordinates feetFirst = lps.toWorld(PatientPosition.FFS);
        Assert.assertArrayEquals("invalid FFS world point", new double[] {3, -1, -2}, feetFirst.getPoint(0), TOLERANCE);
    }

    @Test
    public void testAddAndSubtract() {
        final PatientCoordinates points = new PatientCoordinates(new double[][] {{1, 1, 1}, {2, 2, 2}},
                                                                 CoordinateSystem.LPS);
        final PatientCoordinates offset = PatientCoordinates.ofPoint(new double[] {1, 2, 3}, CoordinateSystem.LPS);

        final PatientCoordinates sum = points.add(offset);
        Assert.assertArrayEquals("single point should be added to every point",
                                 new double[] {3, 4, 5}, sum.getPoint(1), TOLERANCE);

        final PatientCoordinates difference = sum.subtract(points);
        Assert.assertArrayEquals("element by element subtraction failed for point 0",
                                 new double[] {1, 2, 3}, difference.getPoint(0), TOLERANCE);
        Assert.assertArrayEquals("element by element subtraction failed for point 1",
                                 new double[] {1, 2, 3}, difference.getPoint(1), TOLERANCE);
    }

    @Test(expected = IncompatibleFramesException.class)
    public void testMixedFramesAreRejected() {
        final PatientCoordinates lps = PatientCoordinates.ofPoint(new double[] {1, 2, 3}, CoordinateSystem.LPS);
        final PatientCoordinates ras = PatientCoordinates.ofPoint(new double[] {1, 2, 3}, CoordinateSystem.RAS);
        lps.add(ras);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSizeMismatchIsRejected() {
        final PatientCoordinates two = new PatientCoordinates(new double[][] {{1, 1, 1}, {2, 2, 2}},
                                                              CoordinateSystem.LPS);
        final PatientCoordinates three = new PatientCoordinates(new double[][] {{1, 1, 1}, {2, 2, 2}, {3, 3, 3}},
                                                                CoordinateSystem.LPS);
        two.subtract(three);
    }

    @Test
    public void testPointsAreCopied() {
        final double[][] source = {{1, 2, 3}};
        final PatientCoordinates coordinates = new PatientCoordinates(source, CoordinateSystem.LPS);
        source[0][0] = 99;
        coordinates.getPoints()[0][1] = 99;
        Assert.assertArrayEquals("instance should not share point data",
                                 new double[] {1, 2, 3}, coordinates.getPoint(0), TOLERANCE);
    }

}
