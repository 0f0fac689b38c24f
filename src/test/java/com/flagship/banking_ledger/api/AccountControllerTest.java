package com.flagship.banking_ledger.api;

import com.flagship.banking_ledger.ledger.AccountService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.UUID;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.notNullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP surface of account operations: status codes and the error kind in every failure body.
 */
@SpringBootTest
@AutoConfigureMockMvc
class AccountControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private AccountService accountService;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private String openAccount(String balance) {
        String accountId = "API-" + UUID.randomUUID().toString().substring(0, 8);
        accountService.openAccount(accountId, "Api Test", new BigDecimal(balance));
        return accountId;
    }

    private static String amountBody(String amount) {
        return "{\"amount\": " + amount + "}";
    }

    @Nested
    @DisplayName("1. Happy path")
    class HappyPath {

        @Test
        @DisplayName("1.1 Deposit returns the new balance")
        void deposit() throws Exception {
            printTestHeader("POST deposit");
            String accountId = openAccount("1000.00");

            mockMvc.perform(post("/accounts/{id}/deposit", accountId)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(amountBody("500.00")))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.accountId").value(accountId))
                    .andExpect(jsonPath("$.balance").value(1500.0));
        }

        @Test
        @DisplayName("1.2 Withdrawal returns the new balance")
        void withdrawal() throws Exception {
            String accountId = openAccount("1500.00");

            mockMvc.perform(post("/accounts/{id}/withdrawal", accountId)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(amountBody("200.00")))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.balance").value(1300.0));
        }

        @Test
        @DisplayName("1.3 Account info lists recent transactions and echoes the correlation id")
        void accountInfo() throws Exception {
            String accountId = openAccount("100.00");
            accountService.deposit(accountId, new BigDecimal("5.00"));

            mockMvc.perform(get("/accounts/{id}", accountId).header("X-Correlation-ID", "corr-123"))
                    .andExpect(status().isOk())
                    .andExpect(header().string("X-Correlation-ID", "corr-123"))
                    .andExpect(jsonPath("$.customerName").value("Api Test"))
                    .andExpect(jsonPath("$.balance").value(105.0))
                    .andExpect(jsonPath("$.recentTransactions", hasSize(1)))
                    .andExpect(jsonPath("$.recentTransactions[0].type").value("DEPOSIT"))
                    .andExpect(jsonPath("$.accumulatedInterest").value(0.0));
        }

        @Test
        @DisplayName("1.4 Reconciliation and interest history are readable")
        void reconciliationAndHistory() throws Exception {
            String accountId = openAccount("100.00");
            accountService.withdraw(accountId, new BigDecimal("40.00"));

            mockMvc.perform(get("/accounts/{id}/reconciliation", accountId))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.balanced").value(true));

            mockMvc.perform(get("/accounts/{id}/interest-history", accountId))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$", hasSize(0)));
        }

        @Test
        @DisplayName("1.5 A generated correlation id is returned when none is sent")
        void generatedCorrelationId() throws Exception {
            mockMvc.perform(get("/accounts/{id}", "ACC001"))
                    .andExpect(status().isOk())
                    .andExpect(header().string("X-Correlation-ID", notNullValue()));
        }
    }

    @Nested
    @DisplayName("2. Errors")
    class Errors {

        @Test
        @DisplayName("2.1 Unknown account is 404 ACCOUNT_NOT_FOUND")
        void notFound() throws Exception {
            mockMvc.perform(get("/accounts/{id}", "NOPE-" + UUID.randomUUID()))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.kind").value("ACCOUNT_NOT_FOUND"));
        }

        @Test
        @DisplayName("2.2 Overdraw is 400 INSUFFICIENT_FUNDS")
        void insufficientFunds() throws Exception {
            String accountId = openAccount("50.00");

            mockMvc.perform(post("/accounts/{id}/withdrawal", accountId)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(amountBody("100.00")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.kind").value("INSUFFICIENT_FUNDS"))
                    .andExpect(jsonPath("$.message", notNullValue()));
        }

        @Test
        @DisplayName("2.3 Negative and sub-cent amounts are 400 INVALID_AMOUNT")
        void invalidAmount() throws Exception {
            String accountId = openAccount("50.00");

            mockMvc.perform(post("/accounts/{id}/deposit", accountId)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(amountBody("-10.00")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.kind").value("INVALID_AMOUNT"));

            mockMvc.perform(post("/accounts/{id}/deposit", accountId)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(amountBody("0.001")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.kind").value("INVALID_AMOUNT"));
        }

        @Test
        @DisplayName("2.4 Malformed body is 400 INVALID_REQUEST")
        void malformedBody() throws Exception {
            String accountId = openAccount("50.00");

            mockMvc.perform(post("/accounts/{id}/deposit", accountId)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"amount\": \"lots\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.kind").value("INVALID_REQUEST"));
        }
    }
}
