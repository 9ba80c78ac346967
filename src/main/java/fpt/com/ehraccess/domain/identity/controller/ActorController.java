package fpt.com.ehraccess.domain.identity.controller;

import fpt.com.ehraccess.common.constants.Constants;
import fpt.com.ehraccess.common.util.ApiResponse;
import fpt.com.ehraccess.domain.access.service.AccessFacade;
import fpt.com.ehraccess.domain.identity.dto.ActorResponse;
import fpt.com.ehraccess.domain.identity.dto.RegisterActorRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping(Constants.API_PREFIX + "/actors")
public class ActorController {

    private final AccessFacade accessFacade;

    public ActorController(AccessFacade accessFacade) {
        this.accessFacade = accessFacade;
    }

    @PostMapping
    public ResponseEntity<ApiResponse<ActorResponse>> register(@Valid @RequestBody RegisterActorRequest req) {
        ActorResponse actor = ActorResponse.from(accessFacade.register(req.getAddress(), req.getName(), req.getRole()));
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.created(actor));
    }

    @GetMapping("/providers")
    public ResponseEntity<ApiResponse<List<ActorResponse>>> providers() {
        List<ActorResponse> providers = accessFacade.listProviders().stream()
                .map(ActorResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(ApiResponse.ok(providers));
    }

    @GetMapping("/{address}")
    public ResponseEntity<ApiResponse<ActorResponse>> get(@PathVariable String address) {
        return ResponseEntity.ok(ApiResponse.ok(ActorResponse.from(accessFacade.lookupActor(address))));
    }
}
