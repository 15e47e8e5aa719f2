package com.campussso.authserver.model;

public enum FamilyState {
  ACTIVE,
  REVOKED
}
