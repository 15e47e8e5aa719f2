package com.campussso.bridge.service;

import com.campussso.bridge.model.LoginState;
import java.net.URI;

/** authorize への遷移先と、開始したブラウザに cookie で持たせる state の紐付け。 */
public record LoginRedirect(URI authorizeUri, LoginState loginState) {

  public String state() {
    return loginState.state();
  }

  public String browserBinding() {
    return loginState.browserBinding();
  }
}
