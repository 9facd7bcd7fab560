package org.angiofusion.geometry.coordinate;

import Jama.Matrix;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link TransformationMatrix} class.
 */
public class TransformationMatrixTest {

    private static final double TOLERANCE = 1e-9;

    private static final CoordinateSystem[][] DIRECT_COORDINATE_PAIRS = {
            { CoordinateSystem.RAS, CoordinateSystem.LPS },
            { CoordinateSystem.RAS, CoordinateSystem.ILA },
            { CoordinateSystem.LPS, CoordinateSystem.RAS },
            { CoordinateSystem.LPS, CoordinateSystem.ILA },
            { CoordinateSystem.ILA, CoordinateSystem.LPS },
            { CoordinateSystem.ILA, CoordinateSystem.RAS }
    };

    @Test
    public void testExactConstants() {
        assertMatrixEquals("RAS->LPS",
                           new double[][] {{-1, 0, 0}, {0, -1, 0}, {0, 0, 1}},
                           TransformationMatrix.getCoordinateTransform(CoordinateSystem.RAS, CoordinateSystem.LPS));
        assertMatrixEquals("RAS->ILA",
                           new double[][] {{0, 0, -1}, {-1, 0, 0}, {0, 1, 0}},
                           TransformationMatrix.getCoordinateTransform(CoordinateSystem.RAS, CoordinateSystem.ILA));
        assertMatrixEquals("LPS->RAS",
                           new double[][] {{-1, 0, 0}, {0, -1, 0}, {0, 0, 1}},
                           TransformationMatrix.getCoordinateTransform(CoordinateSystem.LPS, CoordinateSystem.RAS));
        assertMatrixEquals("LPS->ILA",
                           new double[][] {{0, 0, -1}, {1, 0, 0}, {0, -1, 0}},
                           TransformationMatrix.getCoordinateTransform(CoordinateSystem.LPS, CoordinateSystem.ILA));
        assertMatrixEquals("ILA->LPS",
                           new double[][] {{0, 1, 0}, {0, 0, -1}, {-1, 0, 0}},
                           TransformationMatrix.getCoordinateTransform(CoordinateSystem.ILA, CoordinateSystem.LPS));
        assertMatrixEquals("ILA->RAS",
                           new double[][] {{0, -1, 0}, {0, 0, 1}, {-1, 0, 0}},
                           TransformationMatrix.getCoordinateTransform(CoordinateSystem.ILA, CoordinateSystem.RAS));
        assertMatrixEquals("HFS->FFS",
                           new double[][] {{-1, 0, 0}, {0, 1, 0}, {0, 0, -1}},
                           TransformationMatrix.getPositionTransform(PatientPosition.HFS, PatientPosition.FFS));
    }

    @Test
    public void testInverseIsTranspose() {
        for (final CoordinateSystem[] pair : DIRECT_COORDINATE_PAIRS) {
            final Matrix forward = TransformationMatrix.getCoordinateTransform(pair[0], pair[1]);
            final Matrix backward = TransformationMatrix.getCoordinateTransform(pair[1], pair[0]);
            final String context = pair[0] + "->" + pair[1];

            assertMatrixEquals(context + " times inverse", Matrix.identity(3, 3).getArray(), forward.times(backward));
            assertMatrixEquals(context + " inverse", backward.getArray(), forward.inverse());
            assertMatrixEquals(context + " transpose", backward.getArray(), forward.transpose());
            Assert.assertEquals(context + " determinant magnitude", 1.0, Math.abs(forward.det()), TOLERANCE);
        }

        final Matrix hfsToFfs = TransformationMatrix.getPositionTransform(PatientPosition.HFS, PatientPosition.FFS);
        final Matrix ffsToHfs = TransformationMatrix.getPositionTransform(PatientPosition.FFS, PatientPosition.HFS);
        assertMatrixEquals("HFS<->FFS", Matrix.identity(3, 3).getArray(), hfsToFfs.times(ffsToHfs));
        assertMatrixEquals("HFS<->FFS transpose", ffsToHfs.getArray(), hfsToFfs.transpose());
    }

    @Test
    public void testIdentityForEqualSystems() {
        for (final CoordinateSystem system : CoordinateSystem.values()) {
            assertMatrixEquals(system + "->" + system, Matrix.identity(3, 3).getArray(),
                               TransformationMatrix.getCoordinateTransform(system, system));
        }
        for (final PatientPosition position : PatientPosition.values()) {
            assertMatrixEquals(position + "->" + position, Matrix.identity(3, 3).getArray(),
                               TransformationMatrix.getPositionTransform(position, position));
        }
    }

    @Test
    public void testReturnedMatrixIsACopy() {
        final Matrix first = TransformationMatrix.getCoordinateTransform(CoordinateSystem.LPS, CoordinateSystem.ILA);
        first.set(0, 0, 42);
        final Matrix second = TransformationMatrix.getCoordinateTransform(CoordinateSystem.LPS, CoordinateSystem.ILA);
        Assert.assertEquals("table constant was modified through returned matrix", 0.0, second.get(0, 0), TOLERANCE);
    }

    @Test(expected = UnsupportedTransformException.class)
    public void testInvalidTargetSystem() {
        TransformationMatrix.getCoordinateTransform(CoordinateSystem.RAS, null);
    }

    @Test(expected = UnsupportedTransformException.class)
    public void testInvalidSourceSystem() {
        TransformationMatrix.getCoordinateTransform(null, CoordinateSystem.LPS);
    }

    @Test(expected = UnsupportedTransformException.class)
    public void testInvalidPosition() {
        TransformationMatrix.getPositionTransform(PatientPosition.HFS, null);
    }

    @Test
    public void testPatientToWorldTransform() {

        assertMatrixEquals("HFS/ILA should be canonical", Matrix.identity(3, 3).getArray(),
                           TransformationMatrix.patientToWorldTransform(PatientPosition.HFS, CoordinateSystem.ILA));

        assertMatrixEquals("HFS/LPS",
                           TransformationMatrix.getCoordinateTransform(CoordinateSystem.LPS, CoordinateSystem.ILA).getArray(),
                           TransformationMatrix.patientToWorldTransform(PatientPosition.HFS, CoordinateSystem.LPS));

        final Matrix expectedFfsLps =
                TransformationMatrix.getCoordinateTransform(CoordinateSystem.LPS, CoordinateSystem.ILA).times(
                        TransformationMatrix.getPositionTransform(PatientPosition.FFS, PatientPosition.HFS));
        assertMatrixEquals("FFS/LPS", expectedFfsLps.getArray(),
                           TransformationMatrix.patientToWorldTransform(PatientPosition.FFS, CoordinateSystem.LPS));

        // position flip is applied before the frame change: FFS x -> -x, z -> -z, then LPS -> ILA
        final double[] point = {1, 2, 3};
        final Matrix transform = TransformationMatrix.patientToWorldTransform(PatientPosition.FFS, CoordinateSystem.LPS);
        final double[] mapped = transform.times(new Matrix(point, 3)).getColumnPackedCopy();
        Assert.assertArrayEquals("FFS/LPS point", new double[] {3, -1, -2}, mapped, TOLERANCE);
    }

    static void assertMatrixEquals(final String context,
                                   final double[][] expected,
                                   final Matrix actual) {
        Assert.assertEquals(context + ": invalid number of rows", expected.length, actual.getRowDimension());
        for (int row = 0; row < expected.length; row++) {
            Assert.assertArrayEquals(context + ": invalid row " + row, expected[row], actual.getArray()[row], TOLERANCE);
        }
    }

}
