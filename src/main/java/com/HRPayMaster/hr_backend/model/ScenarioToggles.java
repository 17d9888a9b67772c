package com.HRPayMaster.hr_backend.model;

import jakarta.persistence.Embeddable;
import lombok.*;

@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScenarioToggles {

    @Builder.Default
    private boolean allowances = true;

    @Builder.Default
    private boolean bonuses = true;

    @Builder.Default
    private boolean deductions = true;

    @Builder.Default
    private boolean loans = true;

    @Builder.Default
    private boolean vacations = true;

    public static ScenarioToggles allEnabled() {
        return ScenarioToggles.builder().build();
    }
}
