package com.newsrelay.service.http;

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
import java.util.Optional;

public final class HttpClientFactory {
    static final String TRUSTSTORE_PATH = "TRUSTSTORE_PATH";
    static final String TRUSTSTORE_PASSWORD = "TRUSTSTORE_PASSWORD";

    private HttpClientFactory() {
    }

    public static HttpClient forFeeds(Duration connectTimeout) {
        return forFeeds(connectTimeout, System.getenv());
    }

    static HttpClient forFeeds(Duration connectTimeout, Map<String, String> environment) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL);
        customTrust(environment).ifPresent(builder::sslContext);
        return builder.build();
    }

    // A private CA bundle for feeds served behind corporate proxies.
    private static Optional<SSLContext> customTrust(Map<String, String> environment) {
        String location = environment.get(TRUSTSTORE_PATH);
        if (location == null || location.isBlank()) {
            return Optional.empty();
        }
        String password = environment.get(TRUSTSTORE_PASSWORD);
        if (password == null) {
            throw new IllegalStateException(TRUSTSTORE_PASSWORD + " must be set when " + TRUSTSTORE_PATH + " is configured");
        }
        Path truststore = Path.of(location);
        if (!Files.isRegularFile(truststore)) {
            throw new IllegalStateException("Truststore file does not exist: " + truststore);
        }

        try (InputStream in = Files.newInputStream(truststore)) {
            KeyStore keyStore = KeyStore.getInstance(keyStoreType(truststore));
            keyStore.load(in, password.toCharArray());
            TrustManagerFactory trustManagers = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            trustManagers.init(keyStore);
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, trustManagers.getTrustManagers(), new SecureRandom());
            return Optional.of(context);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to build SSL context from truststore " + truststore, e);
        }
    }

    static String keyStoreType(Path truststore) {
        String name = truststore.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".p12") || name.endsWith(".pfx") || name.endsWith(".pkcs12") ? "PKCS12" : "JKS";
    }
}
