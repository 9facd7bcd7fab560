package org.angiofusion.client;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.angiofusion.geometry.carm.CArmParameters;

/**
 * Shared input files for client tests.
 */
class ClientTestData {

    static CArmParameters buildCArmParameters(final double alpha,
                                              final double beta) {
        return new CArmParameters(alpha, beta, 1000, 750, null, new double[] {0.2, 0.2}, 512, 512, null);
    }

    static File writeFile(final File file,
                          final String content)
            throws IOException {
        try (final Writer writer = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
            writer.write(content);
        }
        return file;
    }

}
