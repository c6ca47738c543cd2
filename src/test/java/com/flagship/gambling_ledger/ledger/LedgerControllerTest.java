package com.flagship.gambling_ledger.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.gambling_ledger.IntegrationTestSupport;
import com.flagship.gambling_ledger.exclusion.NewSelfExclusion;
import com.flagship.gambling_ledger.exclusion.PlatformType;
import com.flagship.gambling_ledger.exclusion.SelfExclusionService;
import com.flagship.gambling_ledger.exclusion.SelfExclusionType;
import com.flagship.gambling_ledger.ledger.dto.UpdateBalanceBatchRequest;
import com.flagship.gambling_ledger.ledger.dto.UpdateBalanceRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Ledger API: status codes for new, replayed and refused operations.
 */
@SpringBootTest
@AutoConfigureMockMvc
class LedgerControllerTest extends IntegrationTestSupport {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private SelfExclusionService selfExclusionService;

    private UUID userId;

    @BeforeEach
    void setUp() {
        userId = UUID.randomUUID();
    }

    private UpdateBalanceRequest request(BalanceOperationType type, String operationId, String amount) {
        return UpdateBalanceRequest.builder()
                .operation(type)
                .operationId(operationId)
                .userId(userId)
                .amount(new BigDecimal(amount))
                .asset("usdt")
                .platformType(PlatformType.CASINO)
                .build();
    }

    private ResultActions submit(UpdateBalanceRequest request) throws Exception {
        return mockMvc.perform(post("/ledger/operations")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)));
    }

    @Test
    @DisplayName("New operation returns 201, the same request again returns 200 with the stored result")
    void createThenReplay() throws Exception {
        printTestHeader("Ledger replay over HTTP");
        String operationId = "tx-" + UUID.randomUUID();
        UpdateBalanceRequest deposit = request(BalanceOperationType.DEPOSIT, operationId, "250");

        submit(deposit)
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.replayed").value(false))
                .andExpect(jsonPath("$.operation_id").value(operationId));

        submit(deposit)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.replayed").value(true));

        mockMvc.perform(get("/ledger/operations/{operationId}", operationId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.asset").value("USDT"))
                .andExpect(jsonPath("$.operation").value("DEPOSIT"));

        mockMvc.perform(get("/ledger/balances/{userId}", userId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].asset").value("USDT"));
        printSuccess("One operation stored, replay answered from storage");
    }

    @Test
    @DisplayName("Refusals map to 409, 422, 403 and 404")
    void refusals() throws Exception {
        printTestHeader("Ledger refusals");
        String operationId = "tx-" + UUID.randomUUID();
        submit(request(BalanceOperationType.DEPOSIT, operationId, "10")).andExpect(status().isCreated());

        submit(request(BalanceOperationType.DEPOSIT, operationId, "11"))
                .andExpect(status().isConflict());

        submit(request(BalanceOperationType.BET, "bet-" + UUID.randomUUID(), "50"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("Insufficient Balance"));

        selfExclusionService.create(userId, NewSelfExclusion.builder()
                .type(SelfExclusionType.COOLDOWN)
                .platformType(PlatformType.CASINO)
                .build());
        submit(request(BalanceOperationType.BET, "bet-" + UUID.randomUUID(), "5"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.message").value(containsString("cooldown")));

        // Withdrawals stay open during a cooldown
        submit(request(BalanceOperationType.WITHDRAW, "wd-" + UUID.randomUUID(), "5"))
                .andExpect(status().isCreated());

        mockMvc.perform(get("/ledger/operations/{operationId}", "missing-" + UUID.randomUUID()))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Invalid payloads are rejected with 400")
    void validation() throws Exception {
        submit(request(BalanceOperationType.DEPOSIT, "", "10"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Failed"));

        UpdateBalanceRequest unknownAsset = request(BalanceOperationType.DEPOSIT, "tx-" + UUID.randomUUID(), "10");
        unknownAsset.setAsset("EUR");
        submit(unknownAsset)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(containsString("Unsupported asset")));
    }

    @Test
    @DisplayName("A batch returns 201 with one result per entry; an overdrawing batch is 422 and writes nothing")
    void batchEndpoint() throws Exception {
        printTestHeader("Ledger batch over HTTP");
        submit(request(BalanceOperationType.DEPOSIT, "tx-" + UUID.randomUUID(), "40")).andExpect(status().isCreated());

        UpdateBalanceBatchRequest batch = UpdateBalanceBatchRequest.builder()
                .operations(List.of(
                        request(BalanceOperationType.BET, "bet-" + UUID.randomUUID(), "10"),
                        request(BalanceOperationType.WIN, "win-" + UUID.randomUUID(), "25")))
                .build();
        mockMvc.perform(post("/ledger/operations/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(batch)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[1].balance").value(closeTo(55.0, 1e-9), Double.class));

        mockMvc.perform(post("/ledger/operations/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(batch)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].replayed").value(true));

        String overdraw = "bet-" + UUID.randomUUID();
        UpdateBalanceBatchRequest failing = UpdateBalanceBatchRequest.builder()
                .operations(List.of(
                        request(BalanceOperationType.BET, "bet-" + UUID.randomUUID(), "50"),
                        request(BalanceOperationType.BET, overdraw, "50")))
                .build();
        mockMvc.perform(post("/ledger/operations/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(failing)))
                .andExpect(status().isUnprocessableEntity());
        mockMvc.perform(get("/ledger/balances/{userId}/{asset}", userId, "USDT"))
                .andExpect(jsonPath("$.balance").value(closeTo(55.0, 1e-9), Double.class));

        mockMvc.perform(post("/ledger/operations/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"operations\":[]}"))
                .andExpect(status().isBadRequest());
        printSuccess("Batch applied, replayed and rolled back");
    }

    @Test
    @DisplayName("Balance history lists a user's operations newest first")
    void historyEndpoint() throws Exception {
        submit(request(BalanceOperationType.DEPOSIT, "tx-" + UUID.randomUUID(), "30")).andExpect(status().isCreated());
        submit(request(BalanceOperationType.BET, "bet-" + UUID.randomUUID(), "7")).andExpect(status().isCreated());

        mockMvc.perform(get("/ledger/operations")
                        .param("userId", userId.toString())
                        .param("asset", "usdt"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].operation").value("BET"))
                .andExpect(jsonPath("$[0].previous_balance").value(closeTo(30.0, 1e-9), Double.class));

        mockMvc.perform(get("/ledger/operations")
                        .param("userId", userId.toString())
                        .param("operation", "DEPOSIT")
                        .param("limit", "1"))
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].operation").value("DEPOSIT"));

        mockMvc.perform(get("/ledger/operations").param("userId", userId.toString()).param("limit", "500"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/ledger/operations"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Health endpoint reports database and lock store")
    void health() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.database").value("UP"))
                .andExpect(jsonPath("$.lockStore").value("UP"));
    }
}
