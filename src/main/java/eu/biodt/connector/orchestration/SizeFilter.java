package eu.biodt.connector.orchestration;

/**
 * Decides whether an artifact is small enough to be stored.
 */
public final class SizeFilter {

    private SizeFilter() {
        // Utility class
    }

    /**
     * An unknown size is allowed; the caller re-checks once the bytes have been received.
     */
    public static boolean allow(Long sizeBytes, long maxSizeBytes) {
        return sizeBytes == null || sizeBytes <= maxSizeBytes;
    }
}
