package com.backoffice.ledger.controller;

import com.backoffice.ledger.dto.BalanceInitializationResult;
import com.backoffice.ledger.service.BalanceInitializationService;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin")
@PreAuthorize("hasRole('ADMIN')")
public class AdminController {

    private final BalanceInitializationService balanceInitializationService;

    public AdminController(BalanceInitializationService balanceInitializationService) {
        this.balanceInitializationService = balanceInitializationService;
    }

    @PostMapping("/invoices/initialize-balances")
    public BalanceInitializationResult initializeBalances(Authentication authentication) {
        return balanceInitializationService.initializeBalances(authentication.getName());
    }
}
