package com.HRPayMaster.hr_backend.jobs;

import com.HRPayMaster.hr_backend.enums.NotificationPriority;
import com.HRPayMaster.hr_backend.enums.NotificationType;
import com.HRPayMaster.hr_backend.model.Employee;
import com.HRPayMaster.hr_backend.model.VacationRequest;
import com.HRPayMaster.hr_backend.repository.VacationRequestRepository;
import com.HRPayMaster.hr_backend.service.NotificationService;
import com.HRPayMaster.hr_backend.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class VacationReturnAlertJob {

    private final VacationRequestRepository vacationRequestRepository;
    private final NotificationService notificationService;
    private final Clock clock;

    /**
     * Reminds employees still marked on leave whose approved vacation ends within the next two
     * days or ended up to a week ago. Runs every day at 6:00 AM.
     *
     * @return number of notifications created
     */
    @Scheduled(cron = "${hr.alerts.vacation-return-cron:0 0 6 * * *}")
    @Transactional(readOnly = true)
    public int sendReturnAlerts() {
        LocalDate today = LocalDate.now(clock);
        List<VacationRequest> due = vacationRequestRepository.findApprovedEndingBetweenForEmployeesOnLeave(
                today.minusDays(Constants.RETURN_ALERT_OVERDUE_DAYS),
                today.plusDays(Constants.RETURN_ALERT_LOOKAHEAD_DAYS));
        log.info("Found {} approved vacations with a return due around {}", due.size(), today);

        int sent = 0;
        for (VacationRequest vacation : due) {
            Employee employee = vacation.getEmployee();
            if (notificationService.hasUnread(employee.getId(), NotificationType.VACATION_RETURN_DUE, vacation.getId())) {
                continue;
            }
            try {
                notificationService.notify(employee.getId(), NotificationType.VACATION_RETURN_DUE,
                        returnMessage(employee, vacation.getEndDate(), today), priorityFor(vacation.getEndDate(), today),
                        vacation.getId(), vacation.getEndDate().plusDays(Constants.RETURN_ALERT_OVERDUE_DAYS));
                sent++;
            } catch (RuntimeException ex) {
                log.warn("Failed to send return alert for vacation {}: {}", vacation.getId(), ex.getMessage());
            }
        }
        log.info("Sent {} vacation return alerts", sent);
        return sent;
    }

    static String returnMessage(Employee employee, LocalDate endDate, LocalDate today) {
        if (endDate.isBefore(today)) {
            return String.format("%s's vacation ended on %s and they have not been marked as returned",
                    employee.getFullName(), endDate);
        }
        return String.format("%s is due back from vacation after %s", employee.getFullName(), endDate);
    }

    static NotificationPriority priorityFor(LocalDate endDate, LocalDate today) {
        return endDate.isBefore(today) ? NotificationPriority.HIGH : NotificationPriority.MEDIUM;
    }
}
