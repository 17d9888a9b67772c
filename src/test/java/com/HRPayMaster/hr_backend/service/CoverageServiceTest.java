package com.HRPayMaster.hr_backend.service;

import com.HRPayMaster.hr_backend.config.CoverageProperties;
import com.HRPayMaster.hr_backend.dto.response.CoverageResponse;
import com.HRPayMaster.hr_backend.exception.ValidationException;
import com.HRPayMaster.hr_backend.model.Department;
import com.HRPayMaster.hr_backend.model.Employee;
import com.HRPayMaster.hr_backend.model.VacationRequest;
import com.HRPayMaster.hr_backend.repository.VacationRequestRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CoverageService")
class CoverageServiceTest {

    private static final LocalDate START = LocalDate.of(2024, 7, 1);
    private static final LocalDate END = LocalDate.of(2024, 7, 5);

    @Mock
    private VacationRequestRepository vacationRequestRepository;

    private CoverageService coverageService;
    private Department sales;

    @BeforeEach
    void setUp() {
        coverageService = new CoverageService(vacationRequestRepository, new CoverageProperties());
        sales = Department.builder().id(UUID.randomUUID()).name("Sales").build();
    }

    private static Employee employee(Department department) {
        return Employee.builder().id(UUID.randomUUID()).firstName("E").department(department).build();
    }

    private static VacationRequest leave(Employee employee, String start, String end) {
        return VacationRequest.builder()
                .id(UUID.randomUUID())
                .employee(employee)
                .startDate(LocalDate.parse(start))
                .endDate(LocalDate.parse(end))
                .build();
    }

    @Test
    @DisplayName("Two people from one department off on the same day raise an alert")
    void alertAtThreshold() {
        String salesKey = sales.getId().toString();
        CoverageResponse response = CoverageService.tally(List.of(
                leave(employee(sales), "2024-07-01", "2024-07-03"),
                leave(employee(sales), "2024-07-03", "2024-07-08")), START, END, 2);

        assertThat(response.getDays()).containsOnlyKeys(
                LocalDate.of(2024, 7, 1), LocalDate.of(2024, 7, 2), LocalDate.of(2024, 7, 3),
                LocalDate.of(2024, 7, 4), LocalDate.of(2024, 7, 5));
        assertThat(response.getDays().get(LocalDate.of(2024, 7, 3))).containsEntry(salesKey, 2);
        assertThat(response.getAlerts()).singleElement().satisfies(alert -> {
            assertThat(alert.getDate()).isEqualTo(LocalDate.of(2024, 7, 3));
            assertThat(alert.getDepartmentName()).isEqualTo("Sales");
            assertThat(alert.getCount()).isEqualTo(2);
        });
    }

    @Test
    @DisplayName("Overlapping requests of one employee count once")
    void employeeCountedOnce() {
        Employee employee = employee(sales);
        CoverageResponse response = CoverageService.tally(List.of(
                leave(employee, "2024-07-01", "2024-07-02"),
                leave(employee, "2024-07-02", "2024-07-02")), START, END, 2);

        assertThat(response.getDays().get(LocalDate.of(2024, 7, 2))).containsEntry(sales.getId().toString(), 1);
        assertThat(response.getAlerts()).isEmpty();
    }

    @Test
    @DisplayName("Employees without a department land in the unassigned bucket")
    void unassignedBucket() {
        CoverageResponse response = CoverageService.tally(List.of(
                leave(employee(null), "2024-07-04", "2024-07-04")), START, END, 1);

        assertThat(response.getDepartments()).containsEntry("unassigned", "Unassigned");
        assertThat(response.getAlerts()).extracting(CoverageResponse.Alert::getDepartmentId).containsExactly("unassigned");
    }

    @Test
    @DisplayName("The configured threshold applies when none is given")
    void defaultThreshold() {
        when(vacationRequestRepository.findAllOverlapping(any(), eq(START), eq(END))).thenReturn(List.of());

        CoverageResponse response = coverageService.checkCoverage(START, END, null);

        assertThat(response.getThreshold()).isEqualTo(2);
        assertThat(response.getDays()).isEmpty();
    }

    @Test
    @DisplayName("Ranges over a year and non-positive thresholds are rejected")
    void invalidInput() {
        assertThatThrownBy(() -> coverageService.checkCoverage(START, START.plusDays(366), 2))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> coverageService.checkCoverage(START, END, 0))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> coverageService.checkCoverage(END, START, 2))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(vacationRequestRepository);
    }
}
