package com.flagship.banking_ledger.error;

public class AccountNotFoundException extends LedgerException {

    private final String accountId;

    public AccountNotFoundException(String accountId) {
        super(LedgerErrorKind.ACCOUNT_NOT_FOUND, "Account not found: " + accountId);
        this.accountId = accountId;
    }

    public String getAccountId() {
        return accountId;
    }
}
