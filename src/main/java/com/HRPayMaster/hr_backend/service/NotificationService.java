package com.HRPayMaster.hr_backend.service;

import com.HRPayMaster.hr_backend.dto.response.NotificationResponse;
import com.HRPayMaster.hr_backend.dto.response.PaginatedResponse;
import com.HRPayMaster.hr_backend.enums.NotificationPriority;
import com.HRPayMaster.hr_backend.enums.NotificationStatus;
import com.HRPayMaster.hr_backend.enums.NotificationType;
import com.HRPayMaster.hr_backend.exception.ResourceNotFoundException;
import com.HRPayMaster.hr_backend.model.Employee;
import com.HRPayMaster.hr_backend.model.Notification;
import com.HRPayMaster.hr_backend.repository.EmployeeRepository;
import com.HRPayMaster.hr_backend.repository.NotificationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationService {

    private final NotificationRepository notificationRepository;
    private final EmployeeRepository employeeRepository;

    /**
     * Persists a notification in its own transaction so a failure here never rolls back the
     * caller's work.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public NotificationResponse notify(UUID employeeId, NotificationType type, String message,
                                       NotificationPriority priority, UUID referenceId, LocalDate expiresAt) {
        Employee employee = employeeRepository.findById(employeeId)
                .orElseThrow(() -> new ResourceNotFoundException("Employee", "id", employeeId));

        Notification notification = Notification.builder()
                .employee(employee)
                .type(type)
                .title(type.getDefaultTitle())
                .message(message)
                .priority(priority)
                .status(NotificationStatus.UNREAD)
                .referenceId(referenceId)
                .expiresAt(expiresAt)
                .build();

        Notification saved = notificationRepository.save(notification);
        log.debug("Notification {} created for employee {}", type.getValue(), employeeId);
        return mapToResponse(saved);
    }

    @Transactional(readOnly = true)
    public boolean hasUnread(UUID employeeId, NotificationType type, UUID referenceId) {
        return notificationRepository.existsByEmployeeIdAndTypeAndReferenceIdAndStatus(
                employeeId, type, referenceId, NotificationStatus.UNREAD);
    }

    @Transactional(readOnly = true)
    public PaginatedResponse<NotificationResponse> getNotifications(UUID employeeId, int page, int limit) {
        Pageable pageable = PageRequest.of(page - 1, limit, Sort.by("createdAt").descending());
        Page<Notification> notifications = notificationRepository.findByEmployeeId(employeeId, pageable);

        List<NotificationResponse> responses = notifications.getContent()
                .stream()
                .map(this::mapToResponse)
                .collect(Collectors.toList());

        return PaginatedResponse.of(responses, page, limit, notifications.getTotalElements());
    }

    @Transactional
    public NotificationResponse markAsRead(UUID id) {
        Notification notification = notificationRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Notification", "id", id));
        notification.setStatus(NotificationStatus.READ);
        return mapToResponse(notificationRepository.save(notification));
    }

    private NotificationResponse mapToResponse(Notification notification) {
        return NotificationResponse.builder()
                .id(notification.getId())
                .employeeId(notification.getEmployee().getId())
                .type(notification.getType())
                .title(notification.getTitle())
                .message(notification.getMessage())
                .priority(notification.getPriority())
                .status(notification.getStatus())
                .referenceId(notification.getReferenceId())
                .expiresAt(notification.getExpiresAt())
                .createdAt(notification.getCreatedAt())
                .build();
    }
}
