package com.flagship.entity_store.compliance;

import com.flagship.entity_store.compliance.dto.ErasureRequest;
import com.flagship.entity_store.compliance.dto.ErasureResponse;
import com.flagship.entity_store.entity.EntityRef;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/compliance/erasures")
@RequiredArgsConstructor
@Slf4j
public class ComplianceController {

    private final ComplianceErasureService erasureService;

    @PostMapping
    public ResponseEntity<ErasureResponse> erase(@Valid @RequestBody ErasureRequest request) {
        EntityRef ref = EntityRef.parse(request.getEntity());
        log.info("Received erasure request for {} from {}", ref, request.getRequestedBy());
        ErasureRecord record = erasureService.erase(ref, request.getRequestedBy(), request.getReason());
        return ResponseEntity.status(HttpStatus.CREATED).body(ErasureResponse.from(record));
    }

    @GetMapping
    public List<ErasureResponse> history(@RequestParam("entity") String entity) {
        return erasureService.history(EntityRef.parse(entity)).stream()
            .map(ErasureResponse::from)
            .toList();
    }
}
