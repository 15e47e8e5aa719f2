/*
 * どこで: session bridge 設定
 * 何を: back-channel RestClient・cookie 認証フィルタ・SecurityFilterChain をまとめて提供する
 * なぜ: リソースサーバーが @Import 一つで同じ SSO 連携を得られるようにするため
 */
package com.campussso.bridge.config;

import com.campussso.bridge.service.SessionCookieFactory;
import com.campussso.bridge.service.ValidationClient;
import com.campussso.common.security.CertificateFingerprintResolver;
import com.campussso.common.web.RequestMdcInterceptor;
import java.net.http.HttpClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.ssl.SslBundles;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;
import org.springframework.web.client.RestClient;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@EnableScheduling
@EnableConfigurationProperties(BridgeProperties.class)
@ComponentScan(basePackages = "com.campussso.bridge")
public class SessionBridgeConfig implements WebMvcConfigurer {

  @Bean
  RestClient authServerRestClient(
      RestClient.Builder builder,
      BridgeProperties properties,
      ObjectProvider<SslBundles> sslBundles) {
    // auth-server の back-channel 専用。接続・読み取りともに上限を設ける。
    final HttpClient.Builder httpClient =
        HttpClient.newBuilder().connectTimeout(properties.connectTimeout());
    if (properties.sslBundle() != null) {
      final SslBundles bundles = sslBundles.getIfAvailable();
      if (bundles == null) {
        throw new IllegalStateException("ssl bundles are not configured");
      }
      httpClient.sslContext(bundles.getBundle(properties.sslBundle()).createSslContext());
    }
    final JdkClientHttpRequestFactory requestFactory =
        new JdkClientHttpRequestFactory(httpClient.build());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder.baseUrl(properties.authServerBaseUrl()).requestFactory(requestFactory).build();
  }

  @Bean
  CertificateFingerprintResolver bridgeFingerprintResolver(BridgeProperties properties) {
    return new CertificateFingerprintResolver(properties.trustForwardedCertificateHeaders());
  }

  @Bean
  SessionCookieAuthenticationFilter sessionCookieAuthenticationFilter(
      ValidationClient validationClient,
      SessionCookieFactory cookieFactory,
      CertificateFingerprintResolver bridgeFingerprintResolver) {
    return new SessionCookieAuthenticationFilter(
        validationClient, cookieFactory, bridgeFingerprintResolver);
  }

  @Bean
  FilterRegistrationBean<SessionCookieAuthenticationFilter> sessionCookieFilterRegistration(
      SessionCookieAuthenticationFilter filter) {
    // SecurityFilterChain の中でだけ動かす。
    final FilterRegistrationBean<SessionCookieAuthenticationFilter> registration =
        new FilterRegistrationBean<>(filter);
    registration.setEnabled(false);
    return registration;
  }

  @Bean
  SecurityFilterChain sessionBridgeSecurityFilterChain(
      HttpSecurity http, SessionCookieAuthenticationFilter sessionCookieAuthenticationFilter)
      throws Exception {
    http.csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .httpBasic(basic -> basic.disable())
        .formLogin(form -> form.disable())
        .logout(logout -> logout.disable())
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(
                        "/",
                        "/session/login",
                        "/session/callback",
                        "/session/logout",
                        "/error",
                        "/actuator/health",
                        "/actuator/health/**",
                        "/actuator/info",
                        "/actuator/prometheus")
                    .permitAll()
                    .anyRequest()
                    .authenticated())
        .exceptionHandling(ex -> ex.authenticationEntryPoint(new LoginRedirectEntryPoint()))
        .addFilterBefore(sessionCookieAuthenticationFilter, AuthorizationFilter.class);
    return http.build();
  }

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(new RequestMdcInterceptor());
  }
}
