package com.backoffice.ledger.service;

import lombok.Value;

import java.util.Map;

/**
 * Published inside a ledger transaction; written to the audit trail only once
 * that transaction commits.
 */
@Value
public class LedgerAuditEvent {
    public static final String RECORD_PAYMENT = "RECORD_PAYMENT";
    public static final String APPLY_CREDIT = "APPLY_CREDIT";
    public static final String INITIALIZE_BALANCES = "INITIALIZE_BALANCES";

    String actorId;
    String action;
    String entityType;
    String entityId;
    Map<String, Object> before; // null for creations
    Map<String, Object> after;
}
