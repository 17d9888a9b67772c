package com.HRPayMaster.hr_backend.repository;

import com.HRPayMaster.hr_backend.enums.AssignmentStatus;
import com.HRPayMaster.hr_backend.model.AssetAssignment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface AssetAssignmentRepository extends JpaRepository<AssetAssignment, UUID> {
    List<AssetAssignment> findByAssetIdAndStatus(UUID assetId, AssignmentStatus status);

    List<AssetAssignment> findByEmployeeIdOrderByAssignedDateDesc(UUID employeeId);
}
