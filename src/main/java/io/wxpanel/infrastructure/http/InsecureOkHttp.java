package io.wxpanel.infrastructure.http;

import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import okhttp3.OkHttpClient;

/**
 * Builds OkHttp clients that accept any server certificate and host name.
 *
 * <p>The chart servers publish with self-signed certificates; only public, unauthenticated
 * images are requested over these clients.</p>
 *
 * @since 0.1.0
 */
public final class InsecureOkHttp {
  private static final X509TrustManager TRUST_ALL = new X509TrustManager() {
    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType) {}

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType) {}

    @Override
    public X509Certificate[] getAcceptedIssuers() {
      return new X509Certificate[0];
    }
  };

  private InsecureOkHttp() {
    // Utility
  }

  /**
   * Creates a client whose connect, read, and overall call time are bounded by {@code timeout}.
   *
   * @param timeout per-request timeout; must be positive
   * @return configured client
   * @throws IllegalStateException if the JVM offers no TLS implementation
   */
  public static OkHttpClient client(Duration timeout) {
    if (timeout == null || timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    return trustAll(new OkHttpClient.Builder())
        .connectTimeout(timeout)
        .readTimeout(timeout)
        .callTimeout(timeout)
        .followRedirects(true)
        .build();
  }

  /**
   * Installs the trust-all socket factory and host name verifier on a builder.
   *
   * @param builder builder to configure
   * @return the same builder
   */
  public static OkHttpClient.Builder trustAll(OkHttpClient.Builder builder) {
    try {
      SSLContext context = SSLContext.getInstance("TLS");
      context.init(null, new TrustManager[] {TRUST_ALL}, new SecureRandom());
      return builder
          .sslSocketFactory(context.getSocketFactory(), TRUST_ALL)
          .hostnameVerifier((host, session) -> true);
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("TLS is unavailable", ex);
    }
  }
}
