package com.tradejournal.api.dto.request;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.multipart.MultipartFile;

/**
 * Multipart form for uploading one broker statement.
 */
@Data
@NoArgsConstructor
public class ImportStatementRequest {

    @NotNull(message = "Statement file is required")
    private MultipartFile file;

    @NotBlank(message = "Broker is required")
    @Size(max = 64, message = "Broker must be 64 characters or less")
    private String broker;

    /** Defaults to the broker name. */
    @Size(max = 128, message = "Account must be 128 characters or less")
    private String account;

    @DecimalMin(value = "0", message = "Fee per contract must not be negative")
    private BigDecimal feePerContract;

    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
    private LocalDate earliestDate;
}
