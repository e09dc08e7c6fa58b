package com.nft.market.nft_market.entity;

import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One committed movement of a claim vault entry (or of auction escrow).
 * Append-only audit trail, written after the owning operation commits.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@Document(collection = "vault_transactions")
@CompoundIndex(name = "account_currency_seq_idx", def = "{'account':1,'currency':1,'sequence':-1}")
public class VaultTransaction {
    @MongoId
    private String id;

    /**
     * Global commit order.
     */
    @Indexed(unique = true)
    private long sequence;

    /**
     * Account whose entry moved; the zero address for escrow movements.
     */
    private String account;

    private String currency;

    private VaultTransactionType transactionType;

    /**
     * true for credit, false for debit.
     */
    private boolean credit;

    private Money amount;

    /**
     * Entry balance after this movement (escrow total for escrow movements).
     */
    private Money balanceAfter;

    /**
     * Originating record, e.g. "sale:3" or "auction:7".
     */
    private String referenceId;

    private long timestamp;
}
