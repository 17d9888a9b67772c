package com.HRPayMaster.hr_backend.service;

import com.HRPayMaster.hr_backend.dto.request.EmployeeRequest;
import com.HRPayMaster.hr_backend.dto.response.EmployeeResponse;
import com.HRPayMaster.hr_backend.dto.response.PaginatedResponse;
import com.HRPayMaster.hr_backend.enums.EmployeeStatus;
import com.HRPayMaster.hr_backend.exception.ConflictException;
import com.HRPayMaster.hr_backend.exception.ResourceNotFoundException;
import com.HRPayMaster.hr_backend.model.Department;
import com.HRPayMaster.hr_backend.model.Employee;
import com.HRPayMaster.hr_backend.repository.DepartmentRepository;
import com.HRPayMaster.hr_backend.repository.EmployeeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class EmployeeService {

    private final EmployeeRepository employeeRepository;
    private final DepartmentRepository departmentRepository;
    private final ModelMapper modelMapper;

    @Transactional(readOnly = true)
    public EmployeeResponse getEmployeeById(UUID id) {
        Employee employee = employeeRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Employee", "id", id));
        return mapToEmployeeResponse(employee);
    }

    @Transactional(readOnly = true)
    public PaginatedResponse<EmployeeResponse> getAllEmployees(int page, int limit, String search,
                                                               UUID departmentId, EmployeeStatus status) {
        Pageable pageable = PageRequest.of(page - 1, limit, Sort.by("createdAt").descending());

        Page<Employee> employeesPage = employeeRepository.searchEmployees(search, departmentId, status, pageable);

        List<EmployeeResponse> employeeResponses = employeesPage.getContent()
                .stream()
                .map(this::mapToEmployeeResponse)
                .collect(Collectors.toList());

        return PaginatedResponse.of(employeeResponses, page, limit, employeesPage.getTotalElements());
    }

    @Transactional
    public EmployeeResponse createEmployee(EmployeeRequest request) {
        if (employeeRepository.existsByEmployeeCode(request.getEmployeeCode())) {
            throw new ConflictException("Employee code already exists");
        }

        Employee employee = Employee.builder()
                .employeeCode(request.getEmployeeCode())
                .firstName(request.getFirstName())
                .lastName(request.getLastName())
                .email(request.getEmail())
                .phone(request.getPhone())
                .position(request.getPosition())
                .department(resolveDepartment(request.getDepartmentId()))
                .hireDate(request.getHireDate())
                .salary(request.getSalary())
                .standardWorkingDays(request.getStandardWorkingDays())
                .bankName(request.getBankName())
                .bankIban(request.getBankIban())
                .status(EmployeeStatus.ACTIVE)
                .build();

        Employee savedEmployee = employeeRepository.save(employee);
        log.info("Employee created with ID: {}", savedEmployee.getId());

        return mapToEmployeeResponse(savedEmployee);
    }

    @Transactional
    public EmployeeResponse updateEmployee(UUID id, EmployeeRequest request) {
        Employee employee = employeeRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Employee", "id", id));

        if (!employee.getEmployeeCode().equals(request.getEmployeeCode()) &&
                employeeRepository.existsByEmployeeCode(request.getEmployeeCode())) {
            throw new ConflictException("Employee code already exists");
        }

        employee.setEmployeeCode(request.getEmployeeCode());
        employee.setFirstName(request.getFirstName());
        employee.setLastName(request.getLastName());
        employee.setEmail(request.getEmail());
        employee.setPhone(request.getPhone());
        employee.setPosition(request.getPosition());
        employee.setDepartment(resolveDepartment(request.getDepartmentId()));
        employee.setHireDate(request.getHireDate());
        employee.setSalary(request.getSalary());
        employee.setStandardWorkingDays(request.getStandardWorkingDays());
        employee.setBankName(request.getBankName());
        employee.setBankIban(request.getBankIban());

        Employee updatedEmployee = employeeRepository.save(employee);
        log.info("Employee updated with ID: {}", id);

        return mapToEmployeeResponse(updatedEmployee);
    }

    @Transactional
    public EmployeeResponse changeStatus(UUID id, EmployeeStatus status) {
        Employee employee = employeeRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Employee", "id", id));

        EmployeeStatus previous = employee.getStatus();
        employee.setStatus(status);
        Employee updatedEmployee = employeeRepository.save(employee);

        log.info("Employee {} status changed from {} to {}", id, previous, status);
        return mapToEmployeeResponse(updatedEmployee);
    }

    private Department resolveDepartment(UUID departmentId) {
        if (departmentId == null) {
            return null;
        }
        return departmentRepository.findById(departmentId)
                .orElseThrow(() -> new ResourceNotFoundException("Department", "id", departmentId));
    }

    private EmployeeResponse mapToEmployeeResponse(Employee employee) {
        EmployeeResponse response = modelMapper.map(employee, EmployeeResponse.class);

        if (employee.getDepartment() != null) {
            response.setDepartmentId(employee.getDepartment().getId());
            response.setDepartmentName(employee.getDepartment().getName());
        }

        return response;
    }
}
