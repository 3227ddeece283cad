package io.onschedule.core.template;

import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SmsTemplateRepository extends JpaRepository<SmsTemplate, UUID> {
  boolean existsByIdAndDeletedFalse(UUID id);
}
