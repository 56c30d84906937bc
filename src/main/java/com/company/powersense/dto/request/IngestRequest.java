package com.company.powersense.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class IngestRequest {
    @NotNull(message = "rows is required")
    @Size(max = 50000, message = "At most 50000 rows per request")
    private List<@Valid MeasurementRow> rows;
}
