/*
 * どこで: 共通セキュリティユーティリティ
 * 何を: リクエストからクライアント証明書の SHA-256 fingerprint を取り出す
 * なぜ: IdP とリソースサーバーで同じ正規化ルールの fingerprint を比較するため
 */
package com.campussso.common.security;

import jakarta.servlet.http.HttpServletRequest;
import java.io.ByteArrayInputStream;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CertificateFingerprintResolver {

  public static final String FINGERPRINT_HEADER = "X-Client-Cert-Fingerprint";
  public static final String CERTIFICATE_HEADER = "X-Client-Cert";
  static final String X509_ATTRIBUTE = "jakarta.servlet.request.X509Certificate";

  private static final Logger logger =
      LoggerFactory.getLogger(CertificateFingerprintResolver.class);

  private final boolean trustForwardedHeaders;

  public CertificateFingerprintResolver(boolean trustForwardedHeaders) {
    this.trustForwardedHeaders = trustForwardedHeaders;
  }

  /**
   * 役割:
   * - TLS 終端で受け取った証明書、または前段プロキシが付与したヘッダーから fingerprint を解決する。
   *
   * 期待動作:
   * - servlet の X509 属性を最優先する。
   * - ヘッダーは trustForwardedHeaders=true の場合のみ参照する。
   * - 取り出せない場合は empty を返し、例外にはしない。
   */
  public Optional<String> resolve(HttpServletRequest request) {
    final Object attribute = request.getAttribute(X509_ATTRIBUTE);
    if (attribute instanceof X509Certificate[] chain && chain.length > 0) {
      return fingerprintOf(chain[0]);
    }
    if (!trustForwardedHeaders) {
      return Optional.empty();
    }
    final String headerFingerprint = normalize(request.getHeader(FINGERPRINT_HEADER));
    if (headerFingerprint != null) {
      return Optional.of(headerFingerprint);
    }
    final String pem = request.getHeader(CERTIFICATE_HEADER);
    if (pem == null || pem.isBlank()) {
      return Optional.empty();
    }
    return parsePem(pem).flatMap(CertificateFingerprintResolver::fingerprintOf);
  }

  public static String normalize(String raw) {
    if (raw == null) {
      return null;
    }
    final String normalized = raw.replace(":", "").replaceAll("\\s", "").toLowerCase(Locale.ROOT);
    return normalized.isEmpty() ? null : normalized;
  }

  public static boolean matches(String expected, String presented) {
    return SecureCompare.equals(normalize(expected), normalize(presented));
  }

  public static String sha256Hex(byte[] der) {
    try {
      return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(der));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 is not available", ex);
    }
  }

  private static Optional<String> fingerprintOf(X509Certificate certificate) {
    try {
      return Optional.of(sha256Hex(certificate.getEncoded()));
    } catch (java.security.cert.CertificateEncodingException ex) {
      logger.warn("client certificate could not be encoded", ex);
      return Optional.empty();
    }
  }

  private static Optional<X509Certificate> parsePem(String rawPem) {
    // nginx の $ssl_client_escaped_cert は URL エンコードされている。
    final String pem =
        rawPem.contains("%") ? URLDecoder.decode(rawPem, StandardCharsets.UTF_8) : rawPem;
    try {
      final CertificateFactory factory = CertificateFactory.getInstance("X.509");
      return Optional.of(
          (X509Certificate)
              factory.generateCertificate(
                  new ByteArrayInputStream(pem.getBytes(StandardCharsets.US_ASCII))));
    } catch (CertificateException ex) {
      logger.debug("client certificate header is not a valid PEM: {}", ex.getMessage());
      return Optional.empty();
    }
  }
}
