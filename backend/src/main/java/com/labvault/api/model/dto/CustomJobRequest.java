package com.labvault.api.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CustomJobRequest {

    @NotBlank(message = "Job name is required")
    @Size(max = 100, message = "Job name cannot exceed 100 characters")
    @Pattern(regexp = "[A-Za-z0-9][A-Za-z0-9_.-]*", message = "Job name may only contain letters, digits, '.', '_' and '-'")
    private String jobName;

    @NotBlank(message = "Cron expression is required")
    private String cronExpression;

    @Size(max = 500, message = "Description cannot exceed 500 characters")
    private String description;
}
