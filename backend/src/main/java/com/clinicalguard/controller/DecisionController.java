package com.clinicalguard.controller;

import com.clinicalguard.dto.DecisionDTO;
import com.clinicalguard.service.DecisionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/v1/safety/decisions")
@RequiredArgsConstructor
@Tag(name = "Decisions", description = "Clinician decisions and overrides on safety signals")
public class DecisionController {

    private final DecisionService decisionService;

    @PostMapping
    @Operation(summary = "Record acceptance or override of a signal")
    public ResponseEntity<DecisionDTO.Response> recordDecision(
            @AuthenticationPrincipal Jwt jwt,
            @RequestBody DecisionDTO.Request request) {

        String clinicianId = jwt != null ? jwt.getSubject() : null;
        return ResponseEntity.ok(decisionService.record(clinicianId, request));
    }
}
