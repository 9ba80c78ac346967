package fpt.com.ehraccess.domain.accesslog.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChainVerification {
    private Long recordId;
    private int entryCount;
    private boolean valid;
    // null when the chain is intact
    private Integer firstBrokenSequence;
}
