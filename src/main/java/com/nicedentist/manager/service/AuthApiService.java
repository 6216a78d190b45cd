package com.nicedentist.manager.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Client for the separate auth service that owns user logins.
 * Every failure is logged and turned into {@code false}; nothing here throws.
 */
@Service
public class AuthApiService {

    private static final Logger log = LoggerFactory.getLogger(AuthApiService.class);

    private static final String API_KEY_HEADER = "X-API-Key";

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper;
    private final boolean enabled;

    public AuthApiService(RestTemplateBuilder builder,
                          ObjectMapper mapper,
                          @Value("${nicedentist.auth-api.enabled:false}") boolean enabled,
                          @Value("${nicedentist.auth-api.base-url:http://localhost:5000}") String baseUrl,
                          @Value("${nicedentist.auth-api.api-key:}") String apiKey,
                          @Value("${nicedentist.auth-api.timeout-seconds:30}") int timeoutSeconds) {
        RestTemplateBuilder configured = builder
                .rootUri(baseUrl)
                .setConnectTimeout(Duration.ofSeconds(timeoutSeconds))
                .setReadTimeout(Duration.ofSeconds(timeoutSeconds));
        if (StringUtils.isNotBlank(apiKey)) {
            configured = configured.defaultHeader(API_KEY_HEADER, apiKey);
        }
        this.restTemplate = configured.build();
        this.mapper = mapper;
        this.enabled = enabled;
        if (!enabled) {
            log.info("Auth API integration disabled; user accounts are not provisioned remotely");
        }
    }

    public boolean userExistsByEmail(String email) {
        if (!enabled) {
            return false;
        }
        try {
            ResponseEntity<String> response = restTemplate.getForEntity("/api/auth/user/email/{email}/exists", String.class, email);
            JsonNode root = mapper.readTree(StringUtils.defaultIfBlank(response.getBody(), "{}"));
            boolean exists = root.path("exists").asBoolean(false);
            log.debug("Auth API user check for {}: exists={}", email, exists);
            return exists;
        } catch (HttpClientErrorException.NotFound e) {
            return false;
        } catch (RestClientException | JsonProcessingException e) {
            log.error("Auth API user check failed for {}", email, e);
            return false;
        }
    }

    public boolean createUser(String username, String email, String password, String role) {
        if (!enabled) {
            log.info("Auth API disabled, skipping user creation for {}", email);
            return true;
        }
        Map<String, String> body = new LinkedHashMap<>();
        body.put("username", username);
        body.put("email", email);
        body.put("password", password);
        body.put("role", role);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        try {
            ResponseEntity<String> response = restTemplate.postForEntity("/api/auth/register", new HttpEntity<>(body, headers), String.class);
            JsonNode root = mapper.readTree(StringUtils.defaultIfBlank(response.getBody(), "{}"));
            if (!root.path("success").asBoolean(false)) {
                log.warn("Auth API refused user creation for {}: {}", email, root.path("message").asText(""));
                return false;
            }
            log.info("Auth API created {} user for {}", role, email);
            return true;
        } catch (RestClientException | JsonProcessingException e) {
            log.error("Auth API user creation failed for {}", email, e);
            return false;
        }
    }

    /** A user the auth service does not know counts as deleted. */
    public boolean deleteUserByEmail(String email) {
        if (!enabled) {
            log.info("Auth API disabled, skipping user deletion for {}", email);
            return true;
        }
        try {
            restTemplate.delete("/api/auth/user/email/{email}", email);
            log.info("Auth API deleted user {}", email);
            return true;
        } catch (HttpClientErrorException.NotFound e) {
            log.warn("Auth API has no user {}", email);
            return true;
        } catch (RestClientException e) {
            log.error("Auth API user deletion failed for {}", email, e);
            return false;
        }
    }
}
