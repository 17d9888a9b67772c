package com.HRPayMaster.hr_backend.repository;

import com.HRPayMaster.hr_backend.enums.NotificationStatus;
import com.HRPayMaster.hr_backend.enums.NotificationType;
import com.HRPayMaster.hr_backend.model.Notification;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface NotificationRepository extends JpaRepository<Notification, UUID> {
    Page<Notification> findByEmployeeId(UUID employeeId, Pageable pageable);

    boolean existsByEmployeeIdAndTypeAndReferenceIdAndStatus(UUID employeeId, NotificationType type,
                                                            UUID referenceId, NotificationStatus status);
}
