package lab.relay.orchestration;

import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "relay.orchestrator.auto-drive=false",
        "relay.retry.base-delay=10ms",
        "relay.rate-limit.api.max-requests=1000"
})
@AutoConfigureMockMvc
class TransferControllerIntegrationTest {

    private static final String RECIPIENT = "0x2222222222222222222222222222222222222222";

    @Autowired
    private MockMvc mockMvc;

    @Test
    void submitDriveAndConfirmThroughTheApi() throws Exception {
        String id = submit("0xflow");

        mockMvc.perform(get("/transfers/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("PENDING"))
                .andExpect(jsonPath("$.destinationChain").value("polygon"))
                .andExpect(jsonPath("$.maxFeeWei").value(10_000_000_000_000_000L));

        mockMvc.perform(post("/sim/transfers/{id}/next-outcome/{outcome}", id, "TRANSIENT_FAILURE"))
                .andExpect(status().isOk());
        mockMvc.perform(post("/sim/transfers/{id}/next-outcome/{outcome}", id, "TRANSIENT_FAILURE"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.queued").value(2));

        mockMvc.perform(post("/transfers/{id}/drive", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("AWAITING_CONFIRMATION"))
                .andExpect(jsonPath("$.attempts").value(3))
                .andExpect(jsonPath("$.txHandle").isNotEmpty());

        mockMvc.perform(post("/transfers/{id}/drive", id))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.state").value("AWAITING_CONFIRMATION"));

        mockMvc.perform(post("/sim/transfers/{id}/confirm", id).param("success", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("COMPLETED"))
                .andExpect(jsonPath("$.terminal").value(true));
    }

    @Test
    void permanentFailureIsRecordedOnTheRequest() throws Exception {
        String id = submit("0xpermanent");
        mockMvc.perform(post("/sim/transfers/{id}/next-outcome/{outcome}", id, "PERMANENT_FAILURE"))
                .andExpect(status().isOk());

        mockMvc.perform(post("/transfers/{id}/drive", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("FAILED"))
                .andExpect(jsonPath("$.attempts").value(1))
                .andExpect(jsonPath("$.lastError").value(org.hamcrest.Matchers.startsWith("PERMANENT:")));
    }

    @Test
    void invalidSubmitReturnsBadRequestWithReason() throws Exception {
        mockMvc.perform(post("/transfers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "sourceIdentity": "0xinvalid",
                                  "destinationIdentity": "%s",
                                  "destinationChain": "solana",
                                  "payloadKind": "MESSAGE",
                                  "message": "hello",
                                  "maxFee": 0.01
                                }
                                """.formatted(RECIPIENT)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("INVALID"))
                .andExpect(jsonPath("$.reason").value(org.hamcrest.Matchers.startsWith("UNSUPPORTED_DESTINATION_CHAIN: solana")));
    }

    @Test
    void sixthSubmitFromOneSenderIsRateLimited() throws Exception {
        for (int i = 0; i < 5; i++) {
            submit("0xburst");
        }
        mockMvc.perform(post("/transfers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("0xburst")))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.status").value("RATE_LIMITED"));

        mockMvc.perform(get("/transfers").param("sourceIdentity", "0xburst"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(5));
    }

    @Test
    void cancelPendingThenRejectSecondCancel() throws Exception {
        String id = submit("0xcancel");

        mockMvc.perform(post("/transfers/{id}/cancel", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("CANCELLED"));
        mockMvc.perform(post("/transfers/{id}/cancel", id))
                .andExpect(status().isConflict());
        mockMvc.perform(post("/transfers/{id}/drive", id))
                .andExpect(status().isConflict());
    }

    @Test
    void unknownTransferIsNotFound() throws Exception {
        mockMvc.perform(get("/transfers/{id}", UUID.randomUUID()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value(org.hamcrest.Matchers.startsWith("transfer not found")));
    }

    @Test
    void correlationIdIsEchoed() throws Exception {
        mockMvc.perform(get("/transfers/{id}", UUID.randomUUID()).header("X-Correlation-Id", "cid-123"))
                .andExpect(header().string("X-Correlation-Id", "cid-123"));
        mockMvc.perform(get("/transfers/{id}", UUID.randomUUID()))
                .andExpect(header().exists("X-Correlation-Id"));
    }

    private String submit(String source) throws Exception {
        String response = mockMvc.perform(post("/transfers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(source)))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("ACCEPTED"))
                .andReturn()
                .getResponse()
                .getContentAsString();
        return JsonPath.read(response, "$.requestId");
    }

    private static String body(String source) {
        return """
                {
                  "sourceIdentity": "%s",
                  "destinationIdentity": "%s",
                  "destinationChain": "Polygon",
                  "payloadKind": "MESSAGE",
                  "message": "hello from %s",
                  "maxFee": 0.01
                }
                """.formatted(source, RECIPIENT, source);
    }
}
