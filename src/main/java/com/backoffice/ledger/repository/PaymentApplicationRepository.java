package com.backoffice.ledger.repository;

import com.backoffice.ledger.model.PaymentApplication;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;

public interface PaymentApplicationRepository extends JpaRepository<PaymentApplication, Long> {
    List<PaymentApplication> findByPaymentId(Long paymentId);

    List<PaymentApplication> findByPaymentIdIn(Collection<Long> paymentIds);

    @Query("SELECT pa FROM PaymentApplication pa JOIN FETCH pa.payment p JOIN FETCH pa.invoice WHERE p.customer.id = :customerId")
    List<PaymentApplication> findByCustomerId(@Param("customerId") Long customerId);

    @Query("SELECT SUM(pa.amountApplied) FROM PaymentApplication pa WHERE pa.invoice.id = :invoiceId")
    BigDecimal sumAmountAppliedByInvoiceId(@Param("invoiceId") Long invoiceId);

    @Query("SELECT pa.invoice.id, SUM(pa.amountApplied) FROM PaymentApplication pa GROUP BY pa.invoice.id")
    List<Object[]> sumAmountAppliedGroupedByInvoice(); // Returns [invoiceId, applied]
}
