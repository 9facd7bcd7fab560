package org.angiofusion.geometry.volume;

import java.io.IOException;

/**
 * Source of decoded pixel data for a slice (e.g. a DICOM server or local file reader).
 */
public interface SlicePixelLoader {

    /**
     * @param  slice  geometry of the slice to load.
     *
     * @return row-major pixel values with length rows * columns.
     *
     * @throws IOException
     *   if the pixels cannot be loaded.
     */
    short[] loadPixels(final SliceGeometry slice)
            throws IOException;

}
