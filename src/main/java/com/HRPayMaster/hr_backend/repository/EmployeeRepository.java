package com.HRPayMaster.hr_backend.repository;

import com.HRPayMaster.hr_backend.enums.EmployeeStatus;
import com.HRPayMaster.hr_backend.model.Employee;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface EmployeeRepository extends JpaRepository<Employee, UUID> {
    boolean existsByEmployeeCode(String employeeCode);

    List<Employee> findByStatusIn(Collection<EmployeeStatus> statuses);

    @Query("SELECT e FROM Employee e WHERE " +
            "(COALESCE(:search, '') = '' OR " +
            "LOWER(e.firstName) LIKE LOWER(CONCAT('%', :search, '%')) OR " +
            "LOWER(e.lastName) LIKE LOWER(CONCAT('%', :search, '%')) OR " +
            "LOWER(e.employeeCode) LIKE LOWER(CONCAT('%', :search, '%'))) AND " +
            "(:departmentId IS NULL OR e.department.id = :departmentId) AND " +
            "(:status IS NULL OR e.status = :status)")
    Page<Employee> searchEmployees(@Param("search") String search,
                                   @Param("departmentId") UUID departmentId,
                                   @Param("status") EmployeeStatus status,
                                   Pageable pageable);
}
