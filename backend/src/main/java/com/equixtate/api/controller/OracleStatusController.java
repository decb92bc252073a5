package com.equixtate.api.controller;

import com.equixtate.oracle.AttestationOracle;
import com.equixtate.oracle.OracleStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /api/v1/oracle/status: which oracle mode is active and which settings are missing.
 */
@RestController
@RequestMapping("/api/v1/oracle")
@RequiredArgsConstructor
public class OracleStatusController {

    private final AttestationOracle oracle;

    @GetMapping("/status")
    public OracleStatus status() {
        return oracle.status();
    }
}
