package fpt.com.ehraccess.domain.access.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SubmitRecordRequest {

    @NotBlank
    @Size(max = 255)
    private String contentHash;

    @NotBlank
    private String recordType;

    @Size(max = 2000)
    private String description;
}
