package com.HRPayMaster.hr_backend.service;

import com.HRPayMaster.hr_backend.dto.request.DepartmentRequest;
import com.HRPayMaster.hr_backend.dto.response.DepartmentResponse;
import com.HRPayMaster.hr_backend.exception.ConflictException;
import com.HRPayMaster.hr_backend.exception.ResourceNotFoundException;
import com.HRPayMaster.hr_backend.model.Department;
import com.HRPayMaster.hr_backend.repository.DepartmentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class DepartmentService {

    private final DepartmentRepository departmentRepository;
    private final ModelMapper modelMapper;

    public List<DepartmentResponse> getAllDepartments() {
        return departmentRepository.findAll(Sort.by("name").ascending())
                .stream()
                .map(department -> modelMapper.map(department, DepartmentResponse.class))
                .collect(Collectors.toList());
    }

    public DepartmentResponse getDepartmentById(UUID id) {
        Department department = departmentRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Department", "id", id));
        return modelMapper.map(department, DepartmentResponse.class);
    }

    @Transactional
    public DepartmentResponse createDepartment(DepartmentRequest request) {
        if (departmentRepository.existsByNameIgnoreCase(request.getName())) {
            throw new ConflictException("Department with this name already exists");
        }

        Department department = Department.builder()
                .name(request.getName().trim())
                .description(request.getDescription())
                .build();

        Department saved = departmentRepository.save(department);
        log.info("Department created: {} ({})", saved.getName(), saved.getId());
        return modelMapper.map(saved, DepartmentResponse.class);
    }

    @Transactional
    public DepartmentResponse updateDepartment(UUID id, DepartmentRequest request) {
        Department department = departmentRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Department", "id", id));

        if (!department.getName().equalsIgnoreCase(request.getName()) &&
                departmentRepository.existsByNameIgnoreCase(request.getName())) {
            throw new ConflictException("Department with this name already exists");
        }

        department.setName(request.getName().trim());
        department.setDescription(request.getDescription());

        Department updated = departmentRepository.save(department);
        log.info("Department updated: {}", id);
        return modelMapper.map(updated, DepartmentResponse.class);
    }
}
