package fpt.com.ehraccess.domain.authorization.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class AuthorizationChangeResponse {
    private final String patientAddress;
    private final String providerAddress;
    private final boolean active;
    // false when the call was a no-op
    private final boolean changed;
}
