package com.flagship.cash_ledger.ingest;

import com.flagship.cash_ledger.ingest.payload.BalanceTransactionPayload;
import com.flagship.cash_ledger.ingest.payload.BankTransactionPayload;
import com.flagship.cash_ledger.ingest.payload.EventPayload;
import com.flagship.cash_ledger.ingest.payload.OpsInvoicePayload;
import com.flagship.cash_ledger.ingest.payload.OpsPaymentPayload;
import com.flagship.cash_ledger.ingest.payload.PayoutPayload;

/**
 * Kind of inbound observation. Each kind carries its own payload shape.
 */
public enum RawEventKind {
    BANK_TRANSACTION(BankTransactionPayload.class),
    PAYOUT(PayoutPayload.class),
    BALANCE_TRANSACTION(BalanceTransactionPayload.class),
    OPS_PAYMENT(OpsPaymentPayload.class),
    OPS_INVOICE(OpsInvoicePayload.class);

    private final Class<? extends EventPayload> payloadType;

    RawEventKind(Class<? extends EventPayload> payloadType) {
        this.payloadType = payloadType;
    }

    public Class<? extends EventPayload> payloadType() {
        return payloadType;
    }
}
