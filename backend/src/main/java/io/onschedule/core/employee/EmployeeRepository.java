package io.onschedule.core.employee;

import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface EmployeeRepository extends JpaRepository<Employee, UUID> {
  List<Employee> findByIdInAndDeletedFalse(Collection<UUID> ids);
}
