package com.backoffice.ledger.repository;

import com.backoffice.ledger.model.CustomerPayment;
import com.backoffice.ledger.model.PaymentMethod;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public interface CustomerPaymentRepository extends JpaRepository<CustomerPayment, Long> {
    List<CustomerPayment> findByCustomerId(Long customerId);

    Page<CustomerPayment> findByCustomerId(Long customerId, Pageable pageable);

    @Query("SELECT p FROM CustomerPayment p JOIN p.customer c"
            + " WHERE (:method IS NULL OR p.paymentMethod = :method)"
            + " AND (:search IS NULL OR LOWER(c.name) LIKE :search OR LOWER(c.companyName) LIKE :search"
            + " OR LOWER(p.referenceNumber) LIKE :search)"
            + " ORDER BY p.paymentDate DESC, p.id DESC")
    List<CustomerPayment> findRecent(@Param("method") PaymentMethod method, @Param("search") String search,
            Pageable pageable);

    @Query("SELECT SUM(p.amount) FROM CustomerPayment p WHERE p.paymentDate BETWEEN :from AND :to")
    BigDecimal sumAmountBetween(@Param("from") LocalDate from, @Param("to") LocalDate to);
}
