package org.angiofusion.geometry.camera;

import Jama.Matrix;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.angiofusion.geometry.util.DegenerateGeometryException;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link PinholeCamera} class.
 */
public class PinholeCameraTest {

    private static final double TOLERANCE = 1e-9;

    @Test
    public void testIntrinsicMatrix() {
        final Matrix k = PinholeCamera.intrinsicMatrix(1000, new double[] {0.2, 0.25}, new double[] {255.5, 127.5});
        Assert.assertEquals("invalid fx", 5000, k.get(0, 0), TOLERANCE);
        Assert.assertEquals("invalid fy", 4000, k.get(1, 1), TOLERANCE);
        Assert.assertEquals("invalid ox", 255.5, k.get(0, 2), TOLERANCE);
        Assert.assertEquals("invalid oy", 127.5, k.get(1, 2), TOLERANCE);
        Assert.assertEquals("invalid skew", 0, k.get(0, 1), TOLERANCE);
        Assert.assertEquals("invalid homogeneous row", 1, k.get(2, 2), TOLERANCE);
    }

    @Test
    public void testWorldCameraRoundTrip() {
        final Matrix rotation = rotationAboutY(30);
        final double[] origin = {10, -20, 30};
        final double[][] worldPoints = {{1, 2, 3}, {-40, 50, 60}, {0, 0, 0}};

        final double[][] cameraPoints = PinholeCamera.worldToCamera(worldPoints, origin, rotation);
        final double[][] mapped = PinholeCamera.cameraToWorld(cameraPoints, origin, rotation);

        for (int i = 0; i < worldPoints.length; i++) {
            Assert.assertArrayEquals("round trip changed point " + i, worldPoints[i], mapped[i], TOLERANCE);
        }

        final double[][] originInCamera = PinholeCamera.worldToCamera(new double[][] { origin }, origin, rotation);
        Assert.assertArrayEquals("camera origin should map to zero", new double[] {0, 0, 0}, originInCamera[0], TOLERANCE);
    }

    @Test
    public void testImageCameraRoundTrip() {
        final Matrix k = PinholeCamera.intrinsicMatrix(1000, new double[] {0.2, 0.2}, new double[] {255.5, 255.5});
        final double[][] imagePoints = {{0, 0}, {100, 400}, {255.5, 255.5}};

        final double[][] rays = PinholeCamera.imageToCamera(imagePoints, k);
        for (final double[] ray : rays) {
            Assert.assertEquals("normalized ray should have depth 1", 1.0, ray[2], TOLERANCE);
        }

        final double[][] atDepth = PinholeCamera.imageToCamera(imagePoints, k, 1000);
        final double[][] projected = PinholeCamera.cameraToImage(atDepth, k);
        for (int i = 0; i < imagePoints.length; i++) {
            Assert.assertArrayEquals("round trip changed image point " + i, imagePoints[i], projected[i], 1e-6);
        }

        Assert.assertArrayEquals("principal point should back project onto the optical axis",
                                 new double[] {0, 0, 1000}, atDepth[2], TOLERANCE);
    }

    @Test
    public void testToHomogeneous() {
        Assert.assertArrayEquals("2D point should gain a trailing 1",
                                 new double[] {3, 4, 1}, PinholeCamera.toHomogeneous(new double[] {3, 4}), TOLERANCE);
        final double[] homogeneous = {3, 4, 2};
        Assert.assertSame("homogeneous point should be returned as is",
                          homogeneous, PinholeCamera.toHomogeneous(homogeneous));
    }

    @Test(expected = DegenerateGeometryException.class)
    public void testZeroDepthProjection() {
        final Matrix k = PinholeCamera.intrinsicMatrix(1000, new double[] {0.2, 0.2}, new double[] {0, 0});
        PinholeCamera.cameraToImage(new double[][] {{1, 2, 0}}, k);
    }

    @Test(expected = DegenerateGeometryException.class)
    public void testSingularIntrinsicMatrix() {
        PinholeCamera.imageToCamera(new double[][] {{1, 2}}, new Matrix(3, 3));
    }

    @Test(expected = DegenerateGeometryException.class)
    public void testSingularRotation() {
        PinholeCamera.worldToCamera(new double[][] {{1, 2, 3}}, new double[] {0, 0, 0}, new Matrix(3, 3));
    }

    @Test
    public void testTriangulate() {

        final double[] expected = {12.5, -7.25, 40};

        final Matrix k = PinholeCamera.intrinsicMatrix(800, new double[] {0.5, 0.5}, new double[] {320, 240});
        final List<Matrix> projections = new ArrayList<>();
        final List<double[]> imagePoints = new ArrayList<>();
        for (final double degrees : new double[] {-30, 0, 45}) {
            final Matrix rotation = rotationAboutY(degrees);
            final double[] origin = { -600 * Math.sin(Math.toRadians(degrees)), 0, -600 * Math.cos(Math.toRadians(degrees)) };
            final Matrix projection = k.times(extrinsic(rotation, origin));
            projections.add(projection);
            imagePoints.add(project(projection, expected));
        }

        final double[] actual = PinholeCamera.triangulate(projections, imagePoints);
        Assert.assertArrayEquals("invalid triangulated point", expected, actual, 1e-6);

        final double[] fromTwoViews = PinholeCamera.triangulate(projections.subList(0, 2), imagePoints.subList(0, 2));
        Assert.assertArrayEquals("invalid triangulated point from two views", expected, fromTwoViews, 1e-6);
    }

    @Test
    public void testTriangulateRequiresTwoViews() {
        final Matrix projection = new Matrix(3, 4);
        try {
            PinholeCamera.triangulate(Collections.singletonList(projection),
                                      Collections.singletonList(new double[] {1, 2}));
            Assert.fail("single view should have been rejected");
        } catch (final UnderdeterminedSystemException e) {
            Assert.assertTrue("message should name the view count, was: " + e.getMessage(),
                              e.getMessage().contains("1"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testTriangulateCountMismatch() {
        final Matrix projection = new Matrix(3, 4);
        PinholeCamera.triangulate(Arrays.asList(projection, projection),
                                  Collections.singletonList(new double[] {1, 2}));
    }

    static Matrix rotationAboutY(final double degrees) {
        final double radians = Math.toRadians(degrees);
        return new Matrix(new double[][] {
                {  Math.cos(radians), 0, Math.sin(radians) },
                {  0,                 1, 0                 },
                { -Math.sin(radians), 0, Math.cos(radians) }
        });
    }

    private static Matrix extrinsic(final Matrix cameraToWorldRotation,
                                    final double[] origin) {
        final Matrix r = cameraToWorldRotation.transpose();
        final Matrix t = r.times(new Matrix(origin, 3)).times(-1);
        final Matrix extrinsic = new Matrix(3, 4);
        extrinsic.setMatrix(0, 2, 0, 2, r);
        extrinsic.setMatrix(0, 2, 3, 3, t);
        return extrinsic;
    }

    private static double[] project(final Matrix projection,
                                    final double[] point) {
        final Matrix homogeneous = new Matrix(new double[] { point[0], point[1], point[2], 1 }, 4);
        final Matrix image = projection.times(homogeneous);
        return new double[] { image.get(0, 0) / image.get(2, 0), image.get(1, 0) / image.get(2, 0) };
    }

}
