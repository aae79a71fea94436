package com.flagship.member_payments.statement.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EmailStatementRequest {

    @NotBlank(message = "to is required")
    @Email(message = "to must be a valid email address")
    private String to;

    @Size(max = 10, message = "At most 10 additional recipients")
    private List<@Email(message = "additionalEmails must contain valid email addresses") String> additionalEmails;
}
