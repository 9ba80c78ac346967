package fpt.com.ehraccess.domain.identity.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RegisterActorRequest {

    @NotBlank
    @Size(max = 128)
    private String address;

    @NotBlank
    @Size(max = 255)
    private String name;

    // Validated against ActorRole by the registry so unknown values map to INVALID_ROLE
    @NotBlank
    private String role;
}
