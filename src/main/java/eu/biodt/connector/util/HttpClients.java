package eu.biodt.connector.util;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Base64;

/**
 * Factory for the JDK HTTP clients used to talk to Argo and Cordra.
 */
public final class HttpClients {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(30);

    private HttpClients() {
        // Utility class
    }

    /**
     * Build a client. With {@code verifyTls} off, any server certificate is accepted; hostname
     * checks additionally need {@code -Djdk.internal.httpclient.disableHostnameVerification=true}.
     */
    public static HttpClient create(boolean verifyTls) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(CONNECT_TIMEOUT)
                .followRedirects(HttpClient.Redirect.NORMAL);

        if (!verifyTls) {
            builder.sslContext(trustAllContext());
        }
        return builder.build();
    }

    public static String basicAuth(String username, String password) {
        String credentials = username + ":" + password;
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    public static String bearer(String token) {
        return "Bearer " + token;
    }

    private static SSLContext trustAllContext() {
        TrustManager[] trustAll = {new X509TrustManager() {
            @Override
            public void checkClientTrusted(X509Certificate[] chain, String authType) {
            }

            @Override
            public void checkServerTrusted(X509Certificate[] chain, String authType) {
            }

            @Override
            public X509Certificate[] getAcceptedIssuers() {
                return new X509Certificate[0];
            }
        }};

        try {
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, trustAll, null);
            return context;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("TLS not available", e);
        }
    }
}
