package com.campussso.bridge.service;

import com.campussso.bridge.model.LocalSession;

/** callback の結末。失敗時は session が null で、redirectPath はエラー用の遷移先。 */
public record CallbackResult(LocalSession session, String redirectPath, String failure) {

  static CallbackResult established(LocalSession session, String redirectPath) {
    return new CallbackResult(session, redirectPath, null);
  }

  static CallbackResult failed(String failure, String redirectPath) {
    return new CallbackResult(null, redirectPath, failure);
  }

  public boolean succeeded() {
    return session != null;
  }
}
