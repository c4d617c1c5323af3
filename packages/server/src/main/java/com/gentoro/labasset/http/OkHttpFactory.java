package com.gentoro.labasset.http;

import com.gentoro.labasset.exception.ConfigException;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import okhttp3.OkHttpClient;

public class OkHttpFactory {

  /**
   * Client for an outbound integration. {@code callTimeout} bounds the whole call including
   * redirects and body transfer. With {@code verifyTls == false} any server certificate is
   * accepted, which self-hosted record systems with self-signed certificates need.
   */
  public static OkHttpClient create(Duration callTimeout, boolean verifyTls) {
    OkHttpClient.Builder builder =
        new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .readTimeout(callTimeout)
            .callTimeout(callTimeout)
            .addInterceptor(new LoggingInterceptor());
    if (!verifyTls) {
      X509TrustManager trustAll = new TrustAllManager();
      try {
        SSLContext ssl = SSLContext.getInstance("TLS");
        ssl.init(null, new TrustManager[] {trustAll}, new SecureRandom());
        builder.sslSocketFactory(ssl.getSocketFactory(), trustAll).hostnameVerifier((h, s) -> true);
      } catch (GeneralSecurityException e) {
        throw new ConfigException("Could not initialize TLS context with verification disabled", e);
      }
    }
    return builder.build();
  }

  private static final class TrustAllManager implements X509TrustManager {
    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType) {}

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType) {}

    @Override
    public X509Certificate[] getAcceptedIssuers() {
      return new X509Certificate[0];
    }
  }
}
