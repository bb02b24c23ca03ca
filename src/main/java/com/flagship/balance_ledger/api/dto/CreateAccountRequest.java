package com.flagship.balance_ledger.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class CreateAccountRequest {

    @NotBlank(message = "Name is required")
    String name;
}
