package com.flagship.member_payments.statement;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface FinancialStatementRepository extends JpaRepository<FinancialStatementEntity, UUID> {

    boolean existsByUserIdAndDateFromAndDateToAndFormat(UUID userId, LocalDate dateFrom, LocalDate dateTo,
                                                        StatementFormat format);

    List<FinancialStatementEntity> findByUserIdOrderByDateFromDescCreatedAtDesc(UUID userId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM FinancialStatementEntity s WHERE s.id = :id")
    Optional<FinancialStatementEntity> findByIdForUpdate(@Param("id") UUID id);
}
