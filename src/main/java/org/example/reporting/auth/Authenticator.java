package org.example.reporting.auth;

import lombok.extern.slf4j.Slf4j;
import org.example.reporting.config.ReportConfig;
import org.example.reporting.utils.ConfigReader;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Builds the Basic authorization header set shared by every request of a run.
 */
@Slf4j
@Component
public class Authenticator {

    private final UnaryOperator<String> lookup;

    public Authenticator() {
        this(key -> ConfigReader.get(key, null));
    }

    public Authenticator(UnaryOperator<String> lookup) {
        this.lookup = lookup;
    }

    public HttpHeaders authenticate(ReportConfig.Credentials credentials) {
        String usernameEnv = credentials.getUsernameEnv();
        String accessKeyEnv = credentials.getAccessKeyEnv();
        String username = lookup.apply(usernameEnv);
        String accessKey = lookup.apply(accessKeyEnv);

        if (username == null || username.isBlank() || accessKey == null || accessKey.isBlank()) {
            throw new CredentialException("Missing BrowserStack credentials. Please set "
                    + usernameEnv + " and " + accessKeyEnv + ".");
        }

        String token = username + ":" + accessKey;
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION,
                "Basic " + Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.UTF_8)));
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        log.debug("Credentials resolved from {} / {}", usernameEnv, accessKeyEnv);
        return HttpHeaders.readOnlyHttpHeaders(headers);
    }
}
