package com.HRPayMaster.hr_backend.dto.response;

import com.HRPayMaster.hr_backend.enums.AssetStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssetResponse {
    private UUID id;
    private String name;
    private String type;
    private AssetStatus status;
    private String details;
}
