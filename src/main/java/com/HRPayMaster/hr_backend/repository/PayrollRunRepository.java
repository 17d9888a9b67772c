package com.HRPayMaster.hr_backend.repository;

import com.HRPayMaster.hr_backend.model.PayrollRun;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Repository
public interface PayrollRunRepository extends JpaRepository<PayrollRun, UUID> {

    @Query("SELECT r FROM PayrollRun r WHERE r.startDate <= :endDate AND r.endDate >= :startDate " +
            "ORDER BY r.startDate ASC")
    List<PayrollRun> findOverlapping(@Param("startDate") LocalDate startDate,
                                     @Param("endDate") LocalDate endDate);
}
