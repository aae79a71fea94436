package com.flagship.member_payments.notification;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface EmailLogRepository extends JpaRepository<EmailLogEntity, UUID> {

    List<EmailLogEntity> findByUserIdAndTemplateNameOrderByCreatedAtAsc(UUID userId, String templateName);
}
