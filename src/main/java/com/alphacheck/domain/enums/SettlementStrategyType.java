package com.alphacheck.domain.enums;

/**
 * How the T+1 checker determines sellable inventory.
 *
 * <p>LEDGER tracks settled vs unsettled quantity from the PM virtual-position table.
 * AVAILABLE_SELLABLE trusts the upstream pre-computed available sellable volume carried by
 * position snapshots. AUTO picks LEDGER when virtual positions are supplied, otherwise
 * AVAILABLE_SELLABLE when snapshots carry the field.
 */
public enum SettlementStrategyType {
    AUTO,
    LEDGER,
    AVAILABLE_SELLABLE
}
