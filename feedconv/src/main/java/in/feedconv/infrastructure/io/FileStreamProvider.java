package in.feedconv.infrastructure.io;

import in.feedconv.application.port.output.StreamProvider;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.zip.GZIPInputStream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Opens feed files from the local file system.
 *
 * Decoding by extension:
 * - .bz2 bzip2 (the vendor's native packaging)
 * - .gz  GZIP
 * - .zip first entry of the archive
 * - anything else is read as is
 */
public final class FileStreamProvider implements StreamProvider {
    private static final Logger log = LoggerFactory.getLogger(FileStreamProvider.class);

    private static final int BUFFER_SIZE = 64 * 1024;

    @Override
    public InputStream open(Path file) throws IOException {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        InputStream raw = new BufferedInputStream(Files.newInputStream(file), BUFFER_SIZE);

        try {
            if (name.endsWith(".bz2")) {
                return new BZip2CompressorInputStream(raw, true);
            }
            if (name.endsWith(".gz")) {
                return new GZIPInputStream(raw, BUFFER_SIZE);
            }
            if (name.endsWith(".zip")) {
                return firstEntry(file, raw);
            }
            return raw;
        } catch (IOException e) {
            raw.close();
            throw e;
        }
    }

    private static InputStream firstEntry(Path file, InputStream raw) throws IOException {
        ZipInputStream zip = new ZipInputStream(raw);
        ZipEntry entry = zip.getNextEntry();
        while (entry != null && entry.isDirectory()) {
            entry = zip.getNextEntry();
        }
        if (entry == null) {
            throw new IOException("Zip archive has no entries: " + file);
        }
        log.debug("[FileStreamProvider] Reading entry {} from {}", entry.getName(), file);
        return zip;
    }
}
