/*
 * どこで: session bridge サービス層
 * 何を: callback の成否と保護 API での検証結果を記録する
 * なぜ: ログイン導線の失敗や IdP 障害による fail closed を Prometheus から観測するため
 */
package com.campussso.bridge.service;

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
public class BridgeMetrics {

  private static final String METRIC_CALLBACK_TOTAL = "bridge.callback.total";
  private static final String METRIC_VALIDATION_TOTAL = "bridge.validation.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> callbackCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> validationCounters = new ConcurrentHashMap<>();

  public BridgeMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordCallbackResult(String result) {
    callbackCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_CALLBACK_TOTAL)
                    .description("Session bridge callback outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordValidationResult(String result) {
    validationCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_VALIDATION_TOTAL)
                    .description("Session bridge validation outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }
}
