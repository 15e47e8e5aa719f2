package com.campussso.authserver.model;

public enum CodeState {
  PENDING,
  CONSUMED
}
