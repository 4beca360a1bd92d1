package io.b2mash.einvoice.ledger;

import java.math.BigDecimal;

/** Debit/credit totals of a journal entry and whether they balance. */
public record LedgerBalance(
    boolean valid, BigDecimal totalDebit, BigDecimal totalCredit, BigDecimal difference) {}
