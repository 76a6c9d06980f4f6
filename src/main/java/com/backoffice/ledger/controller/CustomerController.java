package com.backoffice.ledger.controller;

import com.backoffice.ledger.dto.CustomerCredits;
import com.backoffice.ledger.dto.CustomerLedger;
import com.backoffice.ledger.dto.OpenInvoices;
import com.backoffice.ledger.dto.PaymentHistory;
import com.backoffice.ledger.service.CustomerAccountService;
import com.backoffice.ledger.service.CustomerLedgerService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/customers/{customerId}")
public class CustomerController {

    private final CustomerLedgerService customerLedgerService;
    private final CustomerAccountService customerAccountService;

    public CustomerController(CustomerLedgerService customerLedgerService,
            CustomerAccountService customerAccountService) {
        this.customerLedgerService = customerLedgerService;
        this.customerAccountService = customerAccountService;
    }

    @GetMapping("/ledger")
    public CustomerLedger ledger(@PathVariable Long customerId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        return customerLedgerService.getLedger(customerId, startDate, endDate);
    }

    @GetMapping("/credits")
    public CustomerCredits credits(@PathVariable Long customerId,
            @RequestParam(defaultValue = "true") boolean activeOnly) {
        return customerAccountService.getCustomerCredits(customerId, activeOnly);
    }

    @GetMapping("/payments")
    public PaymentHistory payments(@PathVariable Long customerId,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int size) {
        return customerAccountService.getCustomerPayments(customerId, page, size);
    }

    @GetMapping("/open-invoices")
    public OpenInvoices openInvoices(@PathVariable Long customerId) {
        return customerAccountService.getOpenInvoices(customerId);
    }
}
