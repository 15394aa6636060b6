package eu.biodt.connector.util;

import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Works out the encoding format recorded on stored file objects.
 */
public final class MediaTypes {

    private static final Logger LOG = Logger.getLogger(MediaTypes.class);

    public static final String OCTET_STREAM = "application/octet-stream";

    // Longest suffix first so ".tar.gz" wins over ".gz"
    private static final List<Map.Entry<String, String>> EXTENSION_TO_MEDIA_TYPE = List.of(
            Map.entry(".tar.gz", "application/gzip"),
            Map.entry(".tgz", "application/gzip"),
            Map.entry(".gz", "application/gzip"),
            Map.entry(".zip", "application/zip"),
            Map.entry(".tar", "application/x-tar"),
            Map.entry(".csv", "text/csv"),
            Map.entry(".tsv", "text/tab-separated-values"),
            Map.entry(".txt", "text/plain"),
            Map.entry(".log", "text/plain"),
            Map.entry(".out", "text/plain"),
            Map.entry(".json", "application/json"),
            Map.entry(".geojson", "application/geo+json"),
            Map.entry(".yaml", "application/yaml"),
            Map.entry(".yml", "application/yaml"),
            Map.entry(".xml", "application/xml"),
            Map.entry(".html", "text/html"),
            Map.entry(".pdf", "application/pdf"),
            Map.entry(".png", "image/png"),
            Map.entry(".jpg", "image/jpeg"),
            Map.entry(".jpeg", "image/jpeg"),
            Map.entry(".tif", "image/tiff"),
            Map.entry(".tiff", "image/tiff"),
            Map.entry(".nc", "application/x-netcdf"),
            Map.entry(".rds", "application/x-rds"),
            Map.entry(".rdata", "application/x-rdata")
    );

    private MediaTypes() {
        // Utility class
    }

    /**
     * Reported type if it is meaningful, otherwise a guess from the file name, otherwise
     * whatever the platform detects for the spooled file. May return null.
     */
    public static String resolve(String reported, String fileName, Path file) {
        if (reported != null && !reported.isBlank() && !isGeneric(reported)) {
            return stripParameters(reported);
        }

        String byName = fromFileName(fileName);
        if (byName != null) {
            return byName;
        }

        if (file != null) {
            try {
                String detected = Files.probeContentType(file);
                if (detected != null) {
                    return detected;
                }
            } catch (IOException e) {
                LOG.debugf(e, "Could not detect content type of %s", file);
            }
        }
        return reported != null && !reported.isBlank() ? stripParameters(reported) : null;
    }

    public static String fromFileName(String fileName) {
        if (fileName == null) {
            return null;
        }
        String lower = fileName.toLowerCase(Locale.ROOT);
        return EXTENSION_TO_MEDIA_TYPE.stream()
                .filter(e -> lower.endsWith(e.getKey()))
                .findFirst()
                .map(Map.Entry::getValue)
                .orElse(null);
    }

    private static boolean isGeneric(String contentType) {
        return stripParameters(contentType).equalsIgnoreCase(OCTET_STREAM);
    }

    private static String stripParameters(String contentType) {
        int semicolon = contentType.indexOf(';');
        return (semicolon >= 0 ? contentType.substring(0, semicolon) : contentType).trim();
    }
}
