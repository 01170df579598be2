package com.dinoventures.ledger.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
public class OpenAccountRequest {

    @NotBlank(message = "type is required")
    @Pattern(regexp = "^(?i)(savings|checking)$", message = "type must be 'savings' or 'checking'")
    private String type;
}
