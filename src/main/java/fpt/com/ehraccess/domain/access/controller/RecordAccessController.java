package fpt.com.ehraccess.domain.access.controller;

import fpt.com.ehraccess.common.constants.Constants;
import fpt.com.ehraccess.common.util.ApiResponse;
import fpt.com.ehraccess.common.web.ClientContextResolver;
import fpt.com.ehraccess.domain.access.dto.RecordEntryDto;
import fpt.com.ehraccess.domain.access.dto.SubmissionResult;
import fpt.com.ehraccess.domain.access.dto.SubmitRecordRequest;
import fpt.com.ehraccess.domain.access.service.AccessFacade;
import fpt.com.ehraccess.domain.accesslog.dto.AccessLogEntryDto;
import fpt.com.ehraccess.domain.accesslog.dto.ChainVerification;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping(Constants.API_PREFIX)
public class RecordAccessController {

    private static final Logger log = LoggerFactory.getLogger(RecordAccessController.class);

    private final AccessFacade accessFacade;
    private final ClientContextResolver clientContextResolver;

    public RecordAccessController(AccessFacade accessFacade, ClientContextResolver clientContextResolver) {
        this.accessFacade = accessFacade;
        this.clientContextResolver = clientContextResolver;
    }

    @PostMapping("/patients/{patient}/records")
    public ResponseEntity<ApiResponse<RecordEntryDto>> submit(@PathVariable String patient,
                                                              @RequestHeader(Constants.ACTOR_HEADER) String caller,
                                                              @Valid @RequestBody SubmitRecordRequest req,
                                                              HttpServletRequest servletRequest) {
        SubmissionResult result = accessFacade.submitRecord(patient, caller, req.getContentHash(),
                req.getRecordType(), req.getDescription(), clientContextResolver.resolve(servletRequest));
        String message = result.isAuditPending() ? Constants.MSG_AUDIT_PENDING : Constants.MSG_CREATED;
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.created(RecordEntryDto.from(result), message));
    }

    @GetMapping("/patients/{patient}/records")
    public ResponseEntity<ApiResponse<List<RecordEntryDto>>> list(@PathVariable String patient,
                                                                  @RequestHeader(Constants.ACTOR_HEADER) String caller,
                                                                  HttpServletRequest servletRequest) {
        List<RecordEntryDto> records = accessFacade.fetchPatientRecords(patient, caller,
                        clientContextResolver.resolve(servletRequest)).stream()
                .map(RecordEntryDto::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(ApiResponse.ok(records));
    }

    @GetMapping("/records/{recordId}")
    public ResponseEntity<ApiResponse<RecordEntryDto>> get(@PathVariable Long recordId,
                                                           @RequestHeader(Constants.ACTOR_HEADER) String caller,
                                                           HttpServletRequest servletRequest) {
        RecordEntryDto record = RecordEntryDto.from(
                accessFacade.fetchRecord(recordId, caller, clientContextResolver.resolve(servletRequest)));
        return ResponseEntity.ok(ApiResponse.ok(record));
    }

    @PostMapping("/records/{recordId}/archive")
    public ResponseEntity<ApiResponse<RecordEntryDto>> archive(@PathVariable Long recordId,
                                                               @RequestHeader(Constants.ACTOR_HEADER) String caller,
                                                               HttpServletRequest servletRequest) {
        RecordEntryDto record = RecordEntryDto.from(
                accessFacade.archiveRecord(recordId, caller, clientContextResolver.resolve(servletRequest)));
        log.info("Archive requested for record {} by {}", recordId, caller);
        return ResponseEntity.ok(ApiResponse.ok(record));
    }

    @GetMapping("/records/{recordId}/access-logs")
    public ResponseEntity<ApiResponse<List<AccessLogEntryDto>>> accessLogs(@PathVariable Long recordId,
                                                                           @RequestHeader(Constants.ACTOR_HEADER) String caller) {
        List<AccessLogEntryDto> entries = accessFacade.fetchAccessLogs(recordId, caller).stream()
                .map(AccessLogEntryDto::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(ApiResponse.ok(entries));
    }

    @GetMapping("/records/{recordId}/access-logs/verify")
    public ResponseEntity<ApiResponse<ChainVerification>> verify(@PathVariable Long recordId,
                                                                 @RequestHeader(Constants.ACTOR_HEADER) String caller) {
        return ResponseEntity.ok(ApiResponse.ok(accessFacade.verifyAccessLogChain(recordId, caller)));
    }
}
