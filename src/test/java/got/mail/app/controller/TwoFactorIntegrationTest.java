package got.mail.app.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import got.mail.app.support.TestAccounts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.Map;

import static org.hamcrest.Matchers.matchesPattern;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class TwoFactorIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private String token;

    @BeforeEach
    void setUp() throws Exception {
        token = TestAccounts.registerAndLogin(mockMvc, objectMapper, TestAccounts.uniquePhoneNumber());
    }

    private String issueCode() throws Exception {
        MvcResult result = mockMvc.perform(post("/2fa/setup").header(HttpHeaders.AUTHORIZATION, token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.verification_code", matchesPattern("\\d{6}")))
                .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return body.get("verification_code").asText();
    }

    private String verifyBody(String code) throws Exception {
        return objectMapper.writeValueAsString(Map.of("verification_code", code));
    }

    private static String wrongCode(String code) {
        return code.equals("000000") ? "111111" : "000000";
    }

    @Test
    void setup_WithCorrectCode_ShouldEnableTwoFactorOnce() throws Exception {
        String code = issueCode();

        mockMvc.perform(put("/2fa/setup")
                        .header(HttpHeaders.AUTHORIZATION, token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(verifyBody(wrongCode(code))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid verification code"));

        mockMvc.perform(put("/2fa/setup")
                        .header(HttpHeaders.AUTHORIZATION, token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(verifyBody(code)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Two-factor authentication enabled"));

        mockMvc.perform(get("/profile").header(HttpHeaders.AUTHORIZATION, token))
                .andExpect(jsonPath("$.profile.two_factor_enabled").value(true));

        // Codes are single use
        mockMvc.perform(put("/2fa/setup")
                        .header(HttpHeaders.AUTHORIZATION, token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(verifyBody(code)))
                .andExpect(status().isBadRequest());
    }

    @Test
    void setup_NewCode_ShouldSupersedePreviousOne() throws Exception {
        String first = issueCode();
        String second = issueCode();

        if (!first.equals(second)) {
            mockMvc.perform(put("/2fa/setup")
                            .header(HttpHeaders.AUTHORIZATION, token)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(verifyBody(first)))
                    .andExpect(status().isBadRequest());
        }

        mockMvc.perform(put("/2fa/setup")
                        .header(HttpHeaders.AUTHORIZATION, token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(verifyBody(second)))
                .andExpect(status().isOk());
    }

    @Test
    void verify_WithoutIssuedCode_ShouldBeRejected() throws Exception {
        mockMvc.perform(put("/2fa/setup")
                        .header(HttpHeaders.AUTHORIZATION, token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(verifyBody("123456")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid verification code"));
    }

    @Test
    void setup_WithoutSession_ShouldBeUnauthorized() throws Exception {
        mockMvc.perform(post("/2fa/setup"))
                .andExpect(status().isUnauthorized());
    }
}
