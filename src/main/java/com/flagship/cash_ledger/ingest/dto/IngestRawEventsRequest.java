package com.flagship.cash_ledger.ingest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class IngestRawEventsRequest {

    @NotNull(message = "Events are required")
    @Size(max = 5000, message = "At most 5000 events per batch")
    @JsonProperty("events")
    private List<RawEventCommand> events;
}
