package in.feedconv.application.port.output;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Opens a raw (decompressed) byte stream for a feed file.
 *
 * Implementations decide how to decode the file based on its extension.
 * The caller owns the returned stream and must close it.
 */
public interface StreamProvider {
    InputStream open(Path file) throws IOException;
}
