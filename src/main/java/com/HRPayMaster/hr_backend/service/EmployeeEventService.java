package com.HRPayMaster.hr_backend.service;

import com.HRPayMaster.hr_backend.dto.request.EmployeeEventRequest;
import com.HRPayMaster.hr_backend.dto.response.EmployeeEventResponse;
import com.HRPayMaster.hr_backend.enums.EventStatus;
import com.HRPayMaster.hr_backend.enums.RecurrenceType;
import com.HRPayMaster.hr_backend.exception.ConflictException;
import com.HRPayMaster.hr_backend.exception.ResourceNotFoundException;
import com.HRPayMaster.hr_backend.exception.ValidationException;
import com.HRPayMaster.hr_backend.model.Employee;
import com.HRPayMaster.hr_backend.model.EmployeeEvent;
import com.HRPayMaster.hr_backend.repository.EmployeeEventRepository;
import com.HRPayMaster.hr_backend.repository.EmployeeRepository;
import com.HRPayMaster.hr_backend.service.EventAggregator.Occurrence;
import com.HRPayMaster.hr_backend.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class EmployeeEventService {

    private final EmployeeEventRepository employeeEventRepository;
    private final EmployeeRepository employeeRepository;

    @Transactional
    public EmployeeEventResponse createEvent(EmployeeEventRequest request) {
        Employee employee = employeeRepository.findById(request.getEmployeeId())
                .orElseThrow(() -> new ResourceNotFoundException("Employee", "id", request.getEmployeeId()));

        RecurrenceType recurrenceType = request.getRecurrenceType() != null ? request.getRecurrenceType() : RecurrenceType.NONE;
        if (recurrenceType == RecurrenceType.NONE && request.getRecurrenceEndDate() != null) {
            throw ValidationException.forField("event", "recurrenceEndDate", "Only recurring events can have an end date");
        }
        if (request.getRecurrenceEndDate() != null && request.getRecurrenceEndDate().isBefore(request.getEventDate())) {
            throw ValidationException.forField("event", "recurrenceEndDate", "Recurrence end date must not precede the event date");
        }

        EmployeeEvent event = EmployeeEvent.builder()
                .employee(employee)
                .eventType(request.getEventType())
                .title(request.getTitle().trim())
                .description(request.getDescription())
                .amount(request.getAmount() != null
                        ? request.getAmount().setScale(Constants.MONEY_SCALE, RoundingMode.HALF_UP)
                        : BigDecimal.ZERO)
                .eventDate(request.getEventDate())
                .affectsPayroll(request.getAffectsPayroll() == null || request.getAffectsPayroll())
                .status(EventStatus.ACTIVE)
                .recurrenceType(recurrenceType)
                .recurrenceEndDate(request.getRecurrenceEndDate())
                .build();

        EmployeeEvent saved = employeeEventRepository.save(event);
        log.info("Employee event {} ({}, {}) created for employee {}",
                saved.getId(), saved.getEventType().getValue(), recurrenceType, employee.getId());
        return mapToResponse(saved, saved.getEventDate());
    }

    @Transactional(readOnly = true)
    public List<EmployeeEventResponse> getEmployeeEvents(UUID employeeId) {
        return employeeEventRepository.findByEmployeeIdOrderByEventDateDesc(employeeId).stream()
                .map(event -> mapToResponse(event, event.getEventDate()))
                .collect(Collectors.toList());
    }

    /**
     * The employee's payroll-relevant occurrences in {@code [startDate, endDate]}, recurring events
     * projected into each month they hit.
     */
    @Transactional(readOnly = true)
    public List<EmployeeEventResponse> getEventsForPeriod(UUID employeeId, LocalDate startDate, LocalDate endDate) {
        if (startDate == null || endDate == null || endDate.isBefore(startDate)) {
            throw new ValidationException("A valid start and end date are required");
        }
        List<EmployeeEvent> candidates = employeeEventRepository.findCandidatesForPeriod(
                employeeId, EventStatus.ACTIVE, startDate, endDate);

        return EventAggregator.expand(candidates, startDate, endDate).stream()
                .sorted(Comparator.comparing(Occurrence::getDate))
                .map(occurrence -> mapToResponse(occurrence.getEvent(), occurrence.getDate()))
                .collect(Collectors.toList());
    }

    @Transactional
    public EmployeeEventResponse cancelEvent(UUID id) {
        EmployeeEvent event = employeeEventRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Employee event", "id", id));
        if (event.getStatus() != EventStatus.ACTIVE) {
            throw new ConflictException("Only active events can be cancelled", "employee_event", id);
        }
        event.setStatus(EventStatus.CANCELLED);
        log.info("Employee event {} cancelled", id);
        EmployeeEvent saved = employeeEventRepository.save(event);
        return mapToResponse(saved, saved.getEventDate());
    }

    private EmployeeEventResponse mapToResponse(EmployeeEvent event, LocalDate occurrenceDate) {
        return EmployeeEventResponse.builder()
                .id(event.getId())
                .employeeId(event.getEmployee().getId())
                .eventType(event.getEventType())
                .title(event.getTitle())
                .description(event.getDescription())
                .amount(event.getAmount())
                .eventDate(event.getEventDate())
                .occurrenceDate(occurrenceDate)
                .affectsPayroll(event.isAffectsPayroll())
                .status(event.getStatus())
                .recurrenceType(event.getRecurrenceType())
                .recurrenceEndDate(event.getRecurrenceEndDate())
                .build();
    }
}
