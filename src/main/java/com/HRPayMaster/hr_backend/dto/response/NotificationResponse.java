package com.HRPayMaster.hr_backend.dto.response;

import com.HRPayMaster.hr_backend.enums.NotificationPriority;
import com.HRPayMaster.hr_backend.enums.NotificationStatus;
import com.HRPayMaster.hr_backend.enums.NotificationType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationResponse {
    private UUID id;
    private UUID employeeId;
    private NotificationType type;
    private String title;
    private String message;
    private NotificationPriority priority;
    private NotificationStatus status;
    private UUID referenceId;
    private LocalDate expiresAt;
    private LocalDateTime createdAt;
}
