package com.pwsrelay.service.http;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

public final class HttpClientFactory {
    public static final String TRUSTSTORE_PATH_ENV = "PWS_TRUSTSTORE_PATH";
    public static final String TRUSTSTORE_PASSWORD_ENV = "PWS_TRUSTSTORE_PASSWORD";

    private HttpClientFactory() {
    }

    public static HttpClient create(Duration connectTimeout) {
        return create(connectTimeout, System.getenv());
    }

    // Upstream answers over HTTP/1.1 and redirects between CDN hosts.
    static HttpClient create(Duration connectTimeout, Map<String, String> environment) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL);
        SSLContext sslContext = sslContextFromEnvironment(environment);
        if (sslContext != null) {
            builder.sslContext(sslContext);
        }
        return builder.build();
    }

    private static SSLContext sslContextFromEnvironment(Map<String, String> environment) {
        String truststorePath = environment.get(TRUSTSTORE_PATH_ENV);
        if (truststorePath == null || truststorePath.isBlank()) {
            return null;
        }

        String truststorePassword = environment.get(TRUSTSTORE_PASSWORD_ENV);
        if (truststorePassword == null) {
            throw new IllegalStateException(TRUSTSTORE_PASSWORD_ENV + " must be set when " + TRUSTSTORE_PATH_ENV + " is configured");
        }

        Path path = Path.of(truststorePath);
        if (!Files.exists(path)) {
            throw new IllegalStateException("Truststore file does not exist: " + path);
        }

        String type = inferTruststoreType(path);
        try (InputStream in = Files.newInputStream(path)) {
            KeyStore trustStore = KeyStore.getInstance(type);
            trustStore.load(in, truststorePassword.toCharArray());

            TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            tmf.init(trustStore);

            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, tmf.getTrustManagers(), new SecureRandom());
            return sslContext;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to build SSL context from truststore " + path, e);
        }
    }

    private static String inferTruststoreType(Path path) {
        String lower = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (lower.endsWith(".p12") || lower.endsWith(".pfx") || lower.endsWith(".pkcs12")) {
            return "PKCS12";
        }
        return "JKS";
    }
}
