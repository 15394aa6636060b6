package eu.biodt.connector.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class MediaTypesTest {

    @Test
    void shouldPreferReportedSpecificType() {
        assertEquals("text/csv", MediaTypes.resolve("text/csv; charset=utf-8", "report.txt", null));
    }

    @Test
    void shouldGuessFromFileNameWhenReportedTypeIsGeneric() {
        assertEquals("image/tiff", MediaTypes.resolve("application/octet-stream", "model.tif", null));
        assertEquals("text/plain", MediaTypes.resolve(null, "main.log", null));
    }

    @Test
    void shouldMatchLongestSuffixFirst() {
        assertEquals("application/gzip", MediaTypes.fromFileName("results.TAR.GZ"));
        assertEquals("application/x-netcdf", MediaTypes.fromFileName("climate.nc"));
    }

    @Test
    void shouldFallBackToReportedGenericType() {
        assertEquals("application/octet-stream", MediaTypes.resolve("application/octet-stream", "blob", null));
    }

    @Test
    void shouldReturnNullWhenNothingIsKnown() {
        assertNull(MediaTypes.fromFileName("README"));
        assertNull(MediaTypes.resolve(null, "README", null));
    }
}
