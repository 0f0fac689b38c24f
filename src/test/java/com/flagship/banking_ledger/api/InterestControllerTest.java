package com.flagship.banking_ledger.api;

import com.flagship.banking_ledger.error.StorageFailureException;
import com.flagship.banking_ledger.interest.AccrualSummary;
import com.flagship.banking_ledger.interest.InterestAccrualEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(InterestController.class)
class InterestControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private InterestAccrualEngine accrualEngine;

    @Test
    @DisplayName("Explicit date runs accrual for that date")
    void explicitDate() throws Exception {
        LocalDate day = LocalDate.of(2030, 3, 1);
        when(accrualEngine.accrueDaily(day)).thenReturn(
                new AccrualSummary(day, new BigDecimal("0.0005"), 4, 1, 0, 0, new BigDecimal("12.50")));

        mockMvc.perform(post("/interest/calculate").param("date", "2030-03-01"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.calculationDate").value("2030-03-01"))
                .andExpect(jsonPath("$.accountsCredited").value(4))
                .andExpect(jsonPath("$.alreadyAccrued").value(1))
                .andExpect(jsonPath("$.totalInterest").value(12.5));
    }

    @Test
    @DisplayName("Storage failure is 500 STORAGE_FAILURE with a generic message")
    void storageFailure() throws Exception {
        when(accrualEngine.accrueDaily()).thenThrow(
                new StorageFailureException("connection refused to 10.0.0.5:5432", null));

        mockMvc.perform(post("/interest/calculate"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.kind").value("STORAGE_FAILURE"))
                .andExpect(jsonPath("$.message").value(GlobalExceptionHandler.GENERIC_STORAGE_MESSAGE));
    }

    @Test
    @DisplayName("Malformed date is 400 INVALID_REQUEST")
    void malformedDate() throws Exception {
        mockMvc.perform(post("/interest/calculate").param("date", "yesterday"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("INVALID_REQUEST"));
    }
}
