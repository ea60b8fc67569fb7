package com.example.photomap.webauthn;

import com.example.photomap.GlobalExceptionHandler;
import com.example.photomap.support.FakeCredentialVerifier;
import com.example.photomap.support.PasskeyTestBed;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class WebAuthnControllerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private PasskeyTestBed bed;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        bed = new PasskeyTestBed();
        mockMvc = MockMvcBuilders.standaloneSetup(new WebAuthnController(bed.registrationService, bed.loginService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void registerThenLoginOverHttp() throws Exception {
        JsonNode registerOptions = options("/api/auth/register/options",
                "{\"email\":\"owner@example.com\",\"displayName\":\"Owner\"}");
        mockMvc.perform(post("/api/auth/register/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(verifyBody("owner@example.com",
                                FakeCredentialVerifier.registrationResponse(registerOptions, "cred-owner"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user.email").value("owner@example.com"))
                .andExpect(jsonPath("$.user.displayName").value("Owner"))
                .andExpect(jsonPath("$.user.isAdmin").value(true))
                .andExpect(jsonPath("$.token").isNotEmpty());

        JsonNode loginOptions = options("/api/auth/login/options", "{\"email\":\"owner@example.com\"}");
        mockMvc.perform(post("/api/auth/login/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(verifyBody("owner@example.com",
                                FakeCredentialVerifier.assertionResponse(loginOptions, "cred-owner"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user.email").value("owner@example.com"))
                .andExpect(jsonPath("$.token").isNotEmpty());
    }

    @Test
    void unknownEmailLoginIsUnauthorized() throws Exception {
        mockMvc.perform(post("/api/auth/login/options")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"nobody@example.com\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("AUTHENTICATION_FAILED"))
                .andExpect(jsonPath("$.message").value("Authentication failed"));
    }

    @Test
    void duplicateRegistrationIsConflict() throws Exception {
        bed.register("owner@example.com", "cred-owner");

        mockMvc.perform(post("/api/auth/register/options")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"owner@example.com\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("EMAIL_ALREADY_REGISTERED"));
    }

    @Test
    void closedRegistrationIsForbidden() throws Exception {
        bed.register("owner@example.com", "cred-owner");

        mockMvc.perform(post("/api/auth/register/options")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"friend@example.com\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("REGISTRATION_CLOSED"));
    }

    @Test
    void malformedEmailFailsValidation() throws Exception {
        mockMvc.perform(post("/api/auth/register/options")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"not-an-email\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.message").value("email: Invalid email format"));
    }

    @Test
    void verifyWithoutCredentialFailsValidation() throws Exception {
        mockMvc.perform(post("/api/auth/login/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"owner@example.com\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("credential: Credential is required"));
    }

    private JsonNode options(String path, String body) throws Exception {
        String response = mockMvc.perform(post(path).contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andReturn()
                .getResponse()
                .getContentAsString();
        JsonNode options = objectMapper.readTree(response).path("options");
        assertThat(options.path("challenge").asText()).isNotBlank();
        return options;
    }

    private String verifyBody(String email, JsonNode credential) throws Exception {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("email", email);
        body.set("credential", credential);
        return objectMapper.writeValueAsString(body);
    }
}
