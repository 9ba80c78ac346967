package fpt.com.ehraccess.domain.authorization.controller;

import fpt.com.ehraccess.common.constants.Constants;
import fpt.com.ehraccess.common.exception.ErrorCode;
import fpt.com.ehraccess.common.exception.ForbiddenException;
import fpt.com.ehraccess.common.util.ApiResponse;
import fpt.com.ehraccess.domain.access.service.AccessFacade;
import fpt.com.ehraccess.domain.authorization.dto.AuthorizationChangeResponse;
import fpt.com.ehraccess.domain.authorization.dto.GrantRequest;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * A patient manages their own providers; the caller header must name the patient in the path.
 */
@RestController
@RequestMapping(Constants.API_PREFIX + "/patients/{patient}/providers")
public class AuthorizationController {

    private final AccessFacade accessFacade;

    public AuthorizationController(AccessFacade accessFacade) {
        this.accessFacade = accessFacade;
    }

    @PostMapping
    public ResponseEntity<ApiResponse<AuthorizationChangeResponse>> grant(@PathVariable String patient,
                                                                          @RequestHeader(Constants.ACTOR_HEADER) String caller,
                                                                          @Valid @RequestBody GrantRequest req) {
        requireSelf(patient, caller);
        boolean changed = accessFacade.grant(patient, req.getProviderAddress());
        return ResponseEntity.ok(ApiResponse.ok(
                new AuthorizationChangeResponse(patient.trim(), req.getProviderAddress().trim(), true, changed)));
    }

    @DeleteMapping("/{provider}")
    public ResponseEntity<ApiResponse<AuthorizationChangeResponse>> revoke(@PathVariable String patient,
                                                                           @PathVariable String provider,
                                                                           @RequestHeader(Constants.ACTOR_HEADER) String caller) {
        requireSelf(patient, caller);
        boolean changed = accessFacade.revoke(patient, provider);
        return ResponseEntity.ok(ApiResponse.ok(
                new AuthorizationChangeResponse(patient.trim(), provider.trim(), false, changed)));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<String>>> list(@PathVariable String patient,
                                                          @RequestHeader(Constants.ACTOR_HEADER) String caller) {
        requireSelf(patient, caller);
        return ResponseEntity.ok(ApiResponse.ok(accessFacade.listAuthorizedProviders(patient)));
    }

    private void requireSelf(String patient, String caller) {
        if (caller == null || !caller.trim().equals(patient.trim())) {
            throw new ForbiddenException(ErrorCode.NOT_AUTHORIZED, Constants.ACTOR_HEADER);
        }
    }
}
