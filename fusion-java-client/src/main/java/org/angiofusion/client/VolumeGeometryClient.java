package org.angiofusion.client;

import com.beust.jcommander.Parameter;

import java.io.IOException;
import java.io.Reader;
import java.io.Serializable;
import java.util.List;

import org.angiofusion.client.parameter.CommandLineParameters;
import org.angiofusion.geometry.coordinate.PatientPosition;
import org.angiofusion.geometry.spec.ImageGeometrySpec;
import org.angiofusion.geometry.volume.SliceGeometry;
import org.angiofusion.geometry.volume.VolumeGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for deriving the spatial layout of a CT series from its per-slice DICOM geometry.
 */
public class VolumeGeometryClient {

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--slicesJson",
                description = "JSON file containing an array of slice geometry records (in any order)",
                required = true)
        public String slicesJson;

        @Parameter(
                names = "--toJson",
                description = "JSON file where the volume geometry is to be stored (.json or .gz)",
                required = true)
        public String toJson;

        @Parameter(
                names = "--centerAtOrigin",
                description = "Shift the image origin so that the volume center lies at (0, 0, 0)",
                arity = 0)
        public boolean centerAtOrigin = false;

        public void validateInputAndOutput() throws IllegalArgumentException {
            FileUtil.validateReadableFile("--slicesJson", slicesJson);
            FileUtil.validateWritableFile("--toJson", toJson);
        }
    }

    /**
     * Image geometry of a volume together with its center and series level attributes.
     */
    public static class VolumeSummary
            implements Serializable {

        private final ImageGeometrySpec imageGeometry;
        private final double[] volumeCenterVoxel;
        private final double[] volumeCenterPosition;
        private final PatientPosition patientPosition;
        private final Double gatingDelay;

        // no-arg constructor needed for JSON deserialization
        @SuppressWarnings("unused")
        private VolumeSummary() {
            this(null, null, null, null, null);
        }

        public VolumeSummary(final ImageGeometrySpec imageGeometry,
                             final double[] volumeCenterVoxel,
                             final double[] volumeCenterPosition,
                             final PatientPosition patientPosition,
                             final Double gatingDelay) {
            this.imageGeometry = imageGeometry;
            this.volumeCenterVoxel = volumeCenterVoxel;
            this.volumeCenterPosition = volumeCenterPosition;
            this.patientPosition = patientPosition;
            this.gatingDelay = gatingDelay;
        }

        public ImageGeometrySpec getImageGeometry() {
            return imageGeometry;
        }

        public double[] getVolumeCenterVoxel() {
            return volumeCenterVoxel;
        }

        public double[] getVolumeCenterPosition() {
            return volumeCenterPosition;
        }

        public PatientPosition getPatientPosition() {
            return patientPosition;
        }

        public Double getGatingDelay() {
            return gatingDelay;
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

                final VolumeGeometryClient client = new VolumeGeometryClient(parameters);
                final VolumeSummary summary = client.buildSummary();

                FileUtil.saveJsonFile(parameters.toJson, summary);
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;

    public VolumeGeometryClient(final Parameters parameters) {
        this.parameters = parameters;
    }

    public VolumeSummary buildSummary()
            throws IOException {

        final List<SliceGeometry> slices;
        try (final Reader reader = FileUtil.DEFAULT_INSTANCE.getExtensionBasedReader(parameters.slicesJson)) {
            slices = SliceGeometry.fromJsonArray(reader);
        }

        LOG.info("buildSummary: loaded {} slices from {}", slices.size(), parameters.slicesJson);

        final VolumeGeometry volume = new VolumeGeometry(slices);

        return new VolumeSummary(ImageGeometrySpec.forVolume(volume, parameters.centerAtOrigin),
                                 volume.getVolumeCenterVoxel(),
                                 volume.getVolumeCenterPosition(),
                                 volume.getPatientPosition(),
                                 volume.getGatingDelay());
    }

    private static final Logger LOG = LoggerFactory.getLogger(VolumeGeometryClient.class);
}
