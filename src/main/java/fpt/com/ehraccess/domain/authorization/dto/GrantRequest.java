package fpt.com.ehraccess.domain.authorization.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class GrantRequest {

    @NotBlank
    @Size(max = 128)
    private String providerAddress;
}
