package com.backoffice.ledger.dto;

import lombok.Value;

import java.util.List;

@Value
public class PaymentHistory {
    List<PaymentView> payments;
    long total;
    int pages;
    int currentPage; // 1-based
    int size;
}
