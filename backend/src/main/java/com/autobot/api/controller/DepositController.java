package com.autobot.api.controller;

import com.autobot.api.dto.DepositSubmissionRequest;
import com.autobot.deposit.store.DepositRecordStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * POST /deposits: registers a bridge deposit for confirmation tracking.
 */
@RestController
@RequestMapping("/api/v1/deposits")
@RequiredArgsConstructor
public class DepositController {

    private final DepositRecordStore depositRecordStore;

    @PostMapping
    public ResponseEntity<Void> submitDeposit(@Valid @RequestBody DepositSubmissionRequest request) {
        depositRecordStore.register(request.chainId().trim(), request.txHash().trim(), request.txNonce().trim());
        return ResponseEntity.ok().build();
    }
}
