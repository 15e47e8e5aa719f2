package com.campussso.bridge.model;

import com.campussso.common.security.SecureCompare;
import java.time.Instant;

/**
 * authorize へ送った state と、ログイン完了後に戻すパス。一度だけ使える。
 *
 * <p>browserBinding はログインを開始したブラウザにだけ cookie で渡した値で、callback 側の cookie と一致した場合のみ有効。
 */
public record LoginState(String state, String browserBinding, String returnPath, Instant expiresAt) {

  public boolean isExpiredAt(Instant now) {
    return !now.isBefore(expiresAt);
  }

  public boolean isBoundTo(String presentedBinding) {
    return SecureCompare.equals(browserBinding, presentedBinding);
  }
}
