package com.backoffice.ledger.repository;

import com.backoffice.ledger.model.Invoice;
import com.backoffice.ledger.model.InvoiceStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface InvoiceRepository extends JpaRepository<Invoice, Long> {
    Optional<Invoice> findByInvoiceNumber(String invoiceNumber);

    List<Invoice> findByCustomerId(Long customerId);

    List<Invoice> findByIdIn(Collection<Long> ids);

    @Query("SELECT i FROM Invoice i WHERE i.customer.id = :customerId AND i.status IN :statuses AND i.balance > 0")
    List<Invoice> findAllocatableByCustomerId(@Param("customerId") Long customerId,
            @Param("statuses") Collection<InvoiceStatus> statuses);

    // Same order a payment would be allocated in: due date with blanks last, then invoice date
    @Query("SELECT i FROM Invoice i JOIN i.customer c"
            + " WHERE i.status IN :statuses AND i.balance > 0"
            + " AND (:search IS NULL OR LOWER(c.name) LIKE :search OR LOWER(c.companyName) LIKE :search"
            + " OR LOWER(i.invoiceNumber) LIKE :search)"
            + " ORDER BY CASE WHEN i.dueDate IS NULL THEN 1 ELSE 0 END, i.dueDate, i.invoiceDate, i.id")
    List<Invoice> findOutstanding(@Param("statuses") Collection<InvoiceStatus> statuses,
            @Param("search") String search, Pageable pageable);

    @Query("SELECT SUM(i.balance) FROM Invoice i WHERE i.status IN :statuses AND i.balance > 0")
    BigDecimal sumOutstandingBalance(@Param("statuses") Collection<InvoiceStatus> statuses);
}
