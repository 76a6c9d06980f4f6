package com.backoffice.ledger.repository;

import com.backoffice.ledger.model.Credit;
import com.backoffice.ledger.model.CreditStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

public interface CreditRepository extends JpaRepository<Credit, Long> {
    Optional<Credit> findBySourcePaymentId(Long paymentId);

    List<Credit> findByCustomerIdOrderByCreatedAtDescIdDesc(Long customerId);

    @Query("SELECT c FROM Credit c WHERE c.customer.id = :customerId AND c.status = :status AND c.availableAmount > 0 ORDER BY c.createdAt DESC, c.id DESC")
    List<Credit> findUsableByCustomerId(@Param("customerId") Long customerId, @Param("status") CreditStatus status);

    // Scalar lookup so the owning customer can be locked before the credit is loaded
    @Query("SELECT c.customer.id FROM Credit c WHERE c.id = :id")
    Optional<Long> findCustomerIdById(@Param("id") Long id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Credit c WHERE c.id = :id")
    Optional<Credit> findByIdForUpdate(@Param("id") Long id);

    @Query("SELECT SUM(c.availableAmount) FROM Credit c WHERE c.status = :status")
    BigDecimal sumAvailableAmountByStatus(@Param("status") CreditStatus status);
}
