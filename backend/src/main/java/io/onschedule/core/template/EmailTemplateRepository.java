package io.onschedule.core.template;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface EmailTemplateRepository extends JpaRepository<EmailTemplate, UUID> {
  Optional<EmailTemplate> findByIdAndDeletedFalse(UUID id);

  boolean existsByIdAndDeletedFalse(UUID id);
}
