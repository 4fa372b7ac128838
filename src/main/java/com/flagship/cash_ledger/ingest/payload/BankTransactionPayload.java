package com.flagship.cash_ledger.ingest.payload;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BankTransactionPayload implements EventPayload {

    @JsonProperty("bank_name")
    private String bankName;

    /** ACH, WIRE, CHECK and so on, as reported by the bank feed. */
    @JsonProperty("transaction_type")
    private String transactionType;

    @JsonProperty("memo")
    private String memo;
}
