package org.angiofusion.geometry.gating;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for the cardiac phase (gating delay) of CT reconstructions and XA cine frames.
 * A gating delay is the fraction of the R-R interval, in [0, 1], at which an image was acquired.
 */
public class GatingDelay {

    private static final Pattern PERCENT_PATTERN = Pattern.compile("(\\d{1,3}(?:\\.\\d+)?)\\s?%");

    /**
     * Parses the reconstruction phase from a series description such as {@code "CorCTA 75% 0.6 Bv40"}.
     *
     * @return the phase as a fraction, or null unless the description contains exactly one percentage.
     */
    public static Double parse(final String seriesDescription) {

        if (seriesDescription == null) {
            return null;
        }

        final Matcher m = PERCENT_PATTERN.matcher(seriesDescription);
        Double delay = null;
        int matchCount = 0;
        while (m.find()) {
            matchCount++;
            delay = Double.parseDouble(m.group(1)) / 100;
        }

        return matchCount == 1 ? delay : null;
    }

    /**
     * @return ECG sampling rate (samples per second) for a cine run.
     */
    public static int getSamplingRate(final int numberOfPoints,
                                      final int numberOfFrames,
                                      final double cineRate)
            throws IllegalArgumentException {
        if (numberOfFrames <= 0) {
            throw new IllegalArgumentException("numberOfFrames must be positive");
        }
        return (int) ((double) numberOfPoints / numberOfFrames * cineRate);
    }

    /**
     * Maps each cine frame to its gating delay.
     *
     * @param  rPeakIndices    ascending ECG sample indices of R peaks.
     * @param  cineRate        frames per second.
     * @param  samplingRate    ECG samples per second.
     * @param  numberOfFrames  number of cine frames.
     *
     * @return delay for each frame, with null for frames before the first
     *         or after the last R peak.
     */
    public static Double[] mapFramesToGatingDelay(final int[] rPeakIndices,
                                                  final double cineRate,
                                                  final int samplingRate,
                                                  final int numberOfFrames)
            throws IllegalArgumentException {

        if (! (cineRate > 0) || (samplingRate <= 0)) {
            throw new IllegalArgumentException("cineRate and samplingRate must be positive");
        }

        final double[] rPeakTimes = new double[rPeakIndices.length];
        for (int i = 0; i < rPeakIndices.length; i++) {
            rPeakTimes[i] = (double) rPeakIndices[i] / samplingRate;
            if ((i > 0) && (rPeakTimes[i] < rPeakTimes[i - 1])) {
                throw new IllegalArgumentException("rPeakIndices must be in ascending order");
            }
        }

        final double frameInterval = 1 / cineRate;
        final Double[] delays = new Double[numberOfFrames];

        for (int frame = 0; frame < numberOfFrames; frame++) {

            final double frameTime = frame * frameInterval;
            final int peak = countPeaksAtOrBefore(rPeakTimes, frameTime);

            if (peak == 0) {
                delays[frame] = null;
            } else if (peak == rPeakTimes.length) {
                delays[frame] = (frameTime == rPeakTimes[peak - 1]) ? 1.0 : null;
            } else {
                final double start = rPeakTimes[peak - 1];
                final double end = rPeakTimes[peak];
                delays[frame] = (frameTime - start) / (end - start);
            }
        }

        return delays;
    }

    private static int countPeaksAtOrBefore(final double[] sortedTimes,
                                            final double time) {
        int low = 0;
        int high = sortedTimes.length;
        while (low < high) {
            final int mid = (low + high) >>> 1;
            if (sortedTimes[mid] <= time) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

}
