package com.tradejournal.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for the admin multi-user trade calculation.
 * Each listed user gets an incremental rebuild; duplicates are processed once.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalculateTradesRequest {

    @NotEmpty
    private List<@NotBlank String> userIds;
}
