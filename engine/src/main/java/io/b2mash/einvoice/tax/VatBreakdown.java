package io.b2mash.einvoice.tax;

import java.math.BigDecimal;

/**
 * Tax base (matrah), VAT amount (KDV tutarı) and total (toplam tutar), each at scale 2.
 * {@code totalAmount == taxBase + taxAmount} within the engine tolerance.
 */
public record VatBreakdown(BigDecimal taxBase, BigDecimal taxAmount, BigDecimal totalAmount) {}
