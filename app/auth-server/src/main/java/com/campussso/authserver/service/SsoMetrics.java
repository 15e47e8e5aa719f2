/*
 * どこで: auth-server サービス層
 * 何を: ログイン結果・トークン発行・プロトコルエラー・refresh 再利用検知を記録する
 * なぜ: 認証導線の成功率と不正利用の兆候を Prometheus から観測できるようにするため
 */
package com.campussso.authserver.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class SsoMetrics {

  private static final String METRIC_LOGIN_TOTAL = "sso.login.total";
  private static final String METRIC_TOKEN_ISSUED_TOTAL = "sso.token.issued.total";
  private static final String METRIC_TOKEN_ERROR_TOTAL = "sso.token.error.total";
  private static final String METRIC_REFRESH_REPLAY_TOTAL = "sso.refresh.replay.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> loginCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> issuedCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
  private final Counter refreshReplayCounter;

  public SsoMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.refreshReplayCounter =
        Counter.builder(METRIC_REFRESH_REPLAY_TOTAL)
            .description("Rotated refresh tokens presented again")
            .register(meterRegistry);
  }

  public void recordLoginResult(String result) {
    loginCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_LOGIN_TOTAL)
                    .description("Identity provider login outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordTokenIssued(String grantType) {
    issuedCounters
        .computeIfAbsent(
            grantType,
            ignored ->
                Counter.builder(METRIC_TOKEN_ISSUED_TOTAL)
                    .description("Token pairs issued by grant type")
                    .tags(Tags.of("grant_type", grantType))
                    .register(meterRegistry))
        .increment();
  }

  public void recordProtocolError(String code) {
    errorCounters
        .computeIfAbsent(
            code,
            ignored ->
                Counter.builder(METRIC_TOKEN_ERROR_TOTAL)
                    .description("Protocol errors returned by the identity provider")
                    .tags(Tags.of("code", code))
                    .register(meterRegistry))
        .increment();
  }

  public void recordRefreshReplay() {
    refreshReplayCounter.increment();
  }
}
