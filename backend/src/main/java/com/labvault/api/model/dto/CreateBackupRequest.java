package com.labvault.api.model.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateBackupRequest {

    @Size(max = 500, message = "Description cannot exceed 500 characters")
    private String description;
}
