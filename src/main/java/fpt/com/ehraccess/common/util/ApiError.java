package fpt.com.ehraccess.common.util;

import fpt.com.ehraccess.common.exception.RetryPolicy;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ApiError {

    private String code;
    private String field;
    private RetryPolicy retry;
}
