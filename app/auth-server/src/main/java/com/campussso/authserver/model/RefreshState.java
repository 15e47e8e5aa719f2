package com.campussso.authserver.model;

public enum RefreshState {
  ACTIVE,
  ROTATED,
  REVOKED
}
