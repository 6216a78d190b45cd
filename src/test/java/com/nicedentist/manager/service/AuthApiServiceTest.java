package com.nicedentist.manager.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.web.client.MockServerRestTemplateCustomizer;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

final class AuthApiServiceTest {

    private static final String BASE = "http://auth.test";

    private MockRestServiceServer server;
    private AuthApiService authApi;

    @BeforeEach
    void setUp() {
        MockServerRestTemplateCustomizer customizer = new MockServerRestTemplateCustomizer();
        authApi = new AuthApiService(new RestTemplateBuilder(customizer), new ObjectMapper(), true, BASE, "secret-key", 5);
        server = customizer.getServer();
    }

    @Test
    void existenceCheckReadsTheFlagAndSendsTheApiKey() {
        server.expect(requestTo(BASE + "/api/auth/user/email/jane@example.com/exists"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("X-API-Key", "secret-key"))
                .andRespond(withSuccess("{\"exists\":true,\"userId\":\"12\"}", MediaType.APPLICATION_JSON));

        assertTrue(authApi.userExistsByEmail("jane@example.com"));
        server.verify();
    }

    @Test
    void existenceCheckTreatsErrorsAsUnknownUser() {
        server.expect(requestTo(BASE + "/api/auth/user/email/jane@example.com/exists"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));
        assertFalse(authApi.userExistsByEmail("jane@example.com"));

        server.reset();
        server.expect(requestTo(BASE + "/api/auth/user/email/jane@example.com/exists"))
                .andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));
        assertFalse(authApi.userExistsByEmail("jane@example.com"));
    }

    @Test
    void createPostsTheRegistration() {
        server.expect(requestTo(BASE + "/api/auth/register"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.username").value("jane_1234"))
                .andExpect(jsonPath("$.email").value("jane@example.com"))
                .andExpect(jsonPath("$.role").value("Customer"))
                .andRespond(withSuccess("{\"success\":true,\"message\":\"ok\"}", MediaType.APPLICATION_JSON));

        assertTrue(authApi.createUser("jane_1234", "jane@example.com", "pw", "Customer"));
        server.verify();
    }

    @Test
    void createFailsWhenTheAuthServiceSaysNo() {
        server.expect(requestTo(BASE + "/api/auth/register"))
                .andRespond(withSuccess("{\"success\":false,\"message\":\"weak password\"}", MediaType.APPLICATION_JSON));
        assertFalse(authApi.createUser("jane_1234", "jane@example.com", "pw", "Customer"));

        server.reset();
        server.expect(requestTo(BASE + "/api/auth/register")).andRespond(withStatus(HttpStatus.BAD_REQUEST));
        assertFalse(authApi.createUser("jane_1234", "jane@example.com", "pw", "Customer"));
    }

    @Test
    void deleteTreatsMissingUserAsDeleted() {
        server.expect(requestTo(BASE + "/api/auth/user/email/jane@example.com"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));
        assertTrue(authApi.deleteUserByEmail("jane@example.com"));

        server.reset();
        server.expect(requestTo(BASE + "/api/auth/user/email/jane@example.com"))
                .andRespond(withStatus(HttpStatus.BAD_GATEWAY));
        assertFalse(authApi.deleteUserByEmail("jane@example.com"));
    }

    @Test
    void disabledClientAnswersLocally() {
        MockServerRestTemplateCustomizer customizer = new MockServerRestTemplateCustomizer();
        AuthApiService disabled = new AuthApiService(new RestTemplateBuilder(customizer), new ObjectMapper(), false, BASE, "", 5);

        assertFalse(disabled.userExistsByEmail("jane@example.com"));
        assertTrue(disabled.createUser("u", "jane@example.com", "p", "Customer"));
        assertTrue(disabled.deleteUserByEmail("jane@example.com"));
        customizer.getServer().verify();
    }
}
