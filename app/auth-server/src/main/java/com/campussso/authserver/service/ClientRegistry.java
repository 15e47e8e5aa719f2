package com.campussso.authserver.service;

import com.campussso.authserver.config.SsoProperties;
import com.campussso.authserver.model.RegisteredClient;
import com.campussso.common.security.SecureCompare;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** 設定で固定登録された client の一覧。起動後は読み取り専用。 */
@Component
public class ClientRegistry {

  private static final Logger logger = LoggerFactory.getLogger(ClientRegistry.class);

  private final Map<String, RegisteredClient> clients;

  public ClientRegistry(SsoProperties properties) {
    this.clients =
        properties.clients().entrySet().stream()
            .collect(
                Collectors.toUnmodifiableMap(
                    Map.Entry::getKey,
                    entry ->
                        new RegisteredClient(
                            entry.getKey(),
                            entry.getValue().secret(),
                            entry.getValue().redirectUri(),
                            entry.getValue().scopes())));
    logger.info("client registry loaded clients={}", clients.keySet());
  }

  public Optional<RegisteredClient> find(String clientId) {
    if (clientId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(clients.get(clientId));
  }

  public RegisteredClient require(String clientId) {
    return find(clientId)
        .orElseThrow(
            () -> new SsoException(SsoException.Reason.UNKNOWN_CLIENT, "client is not registered"));
  }

  /** client_id と client_secret を定数時間で照合する。未知 client も同じ失敗理由にする。 */
  public RegisteredClient authenticate(String clientId, String clientSecret) {
    final Optional<RegisteredClient> client = find(clientId);
    if (client.isEmpty() || !SecureCompare.equals(client.get().clientSecret(), clientSecret)) {
      logger.warn("client authentication failed clientId={}", clientId);
      throw new SsoException(
          SsoException.Reason.CLIENT_AUTH_FAILED, "client authentication failed");
    }
    return client.get();
  }
}
