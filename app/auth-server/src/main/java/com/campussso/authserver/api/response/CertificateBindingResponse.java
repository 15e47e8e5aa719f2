package com.campussso.authserver.api.response;

import com.campussso.authserver.model.UserRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CertificateBindingResponse(
    String subject, String role, String certFingerprint, Instant updatedAt) {

  public static CertificateBindingResponse from(UserRecord user) {
    return new CertificateBindingResponse(
        user.subjectId(),
        user.role().wireValue(),
        user.certificateFingerprint(),
        user.updatedAt());
  }
}
