package com.backoffice.ledger.repository;

import com.backoffice.ledger.model.CreditApplication;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.util.List;

public interface CreditApplicationRepository extends JpaRepository<CreditApplication, Long> {
    List<CreditApplication> findByCreditId(Long creditId);

    @Query("SELECT ca FROM CreditApplication ca JOIN FETCH ca.credit c JOIN FETCH ca.invoice WHERE c.customer.id = :customerId")
    List<CreditApplication> findByCustomerId(@Param("customerId") Long customerId);

    @Query("SELECT SUM(ca.amountApplied) FROM CreditApplication ca WHERE ca.invoice.id = :invoiceId")
    BigDecimal sumAmountAppliedByInvoiceId(@Param("invoiceId") Long invoiceId);

    @Query("SELECT SUM(ca.amountApplied) FROM CreditApplication ca WHERE ca.credit.id = :creditId")
    BigDecimal sumAmountAppliedByCreditId(@Param("creditId") Long creditId);

    @Query("SELECT ca.invoice.id, SUM(ca.amountApplied) FROM CreditApplication ca GROUP BY ca.invoice.id")
    List<Object[]> sumAmountAppliedGroupedByInvoice(); // Returns [invoiceId, applied]
}
