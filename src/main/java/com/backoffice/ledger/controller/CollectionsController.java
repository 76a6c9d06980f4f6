package com.backoffice.ledger.controller;

import com.backoffice.ledger.dto.AllocationPreview;
import com.backoffice.ledger.dto.AllocationResult;
import com.backoffice.ledger.dto.ApplyCreditRequest;
import com.backoffice.ledger.dto.CollectionsSummary;
import com.backoffice.ledger.dto.CreditApplicationResult;
import com.backoffice.ledger.dto.OutstandingInvoiceView;
import com.backoffice.ledger.dto.PaymentView;
import com.backoffice.ledger.dto.PreviewAllocationRequest;
import com.backoffice.ledger.dto.RecordPaymentRequest;
import com.backoffice.ledger.exception.InvalidArgumentException;
import com.backoffice.ledger.model.PaymentMethod;
import com.backoffice.ledger.service.CreditApplicationService;
import com.backoffice.ledger.service.CustomerAccountService;
import com.backoffice.ledger.service.PaymentAllocationService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/collections")
public class CollectionsController {

    private final PaymentAllocationService paymentAllocationService;
    private final CreditApplicationService creditApplicationService;
    private final CustomerAccountService customerAccountService;

    public CollectionsController(PaymentAllocationService paymentAllocationService,
            CreditApplicationService creditApplicationService, CustomerAccountService customerAccountService) {
        this.paymentAllocationService = paymentAllocationService;
        this.creditApplicationService = creditApplicationService;
        this.customerAccountService = customerAccountService;
    }

    @PostMapping("/payments")
    public ResponseEntity<AllocationResult> recordPayment(@RequestBody RecordPaymentRequest request,
            Authentication authentication) {
        // The recorder is always the authenticated user, whatever the body says
        RecordPaymentRequest attributed = request.toBuilder().recordedBy(authentication.getName()).build();
        return ResponseEntity.status(HttpStatus.CREATED).body(paymentAllocationService.allocate(attributed));
    }

    @PostMapping("/payments/preview")
    public AllocationPreview previewAllocation(@RequestBody PreviewAllocationRequest request) {
        return paymentAllocationService.preview(request);
    }

    @GetMapping("/payments/recent")
    public List<PaymentView> recentPayments(@RequestParam(defaultValue = "10") int limit,
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(required = false) String paymentMethod,
            @RequestParam(required = false) String search) {
        return customerAccountService.getRecentPayments(limit, offset, parseMethodFilter(paymentMethod), search);
    }

    @GetMapping("/payments/outstanding")
    public List<OutstandingInvoiceView> outstandingInvoices(@RequestParam(defaultValue = "10") int limit,
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(required = false) String search) {
        return customerAccountService.getOutstandingInvoices(limit, offset, search);
    }

    @PostMapping("/credits/apply")
    public CreditApplicationResult applyCredit(@RequestBody ApplyCreditRequest request,
            Authentication authentication) {
        return creditApplicationService.applyCredit(request.toBuilder().actorId(authentication.getName()).build());
    }

    @GetMapping("/summary")
    public CollectionsSummary summary() {
        return customerAccountService.getCollectionsSummary();
    }

    // "ALL" or blank means no filter
    private static PaymentMethod parseMethodFilter(String paymentMethod) {
        if (paymentMethod == null || paymentMethod.isBlank() || "ALL".equalsIgnoreCase(paymentMethod)) {
            return null;
        }
        try {
            return PaymentMethod.valueOf(paymentMethod.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidArgumentException("Unknown payment method: " + paymentMethod);
        }
    }

    @GetMapping("/payment-methods")
    public List<Map<String, String>> paymentMethods() {
        List<Map<String, String>> methods = new ArrayList<>();
        for (PaymentMethod method : PaymentMethod.values()) {
            Map<String, String> entry = new LinkedHashMap<>();
            entry.put("value", method.name());
            entry.put("label", method.getLabel());
            methods.add(entry);
        }
        return methods;
    }
}
