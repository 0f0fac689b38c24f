package com.flagship.banking_ledger.ledger;

import lombok.Value;

/**
 * One side of a multi-account mutation: the account, its balance-delta function and the row to append.
 */
@Value
public class Leg {
    String accountId;
    BalanceMutation mutation;
    TransactionDraft draft;
}
