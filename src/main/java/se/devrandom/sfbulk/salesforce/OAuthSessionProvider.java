/*
 * SF Bulk - Salesforce Bulk API job orchestrator
 * Copyright (C) 2025 Johan Karlsteen
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package se.devrandom.sfbulk.salesforce;

import io.jsonwebtoken.Jwts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import se.devrandom.sfbulk.config.SalesforceCredentials;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.util.Base64;
import java.util.Date;

/**
 * Logs in through the OAuth 2.0 token endpoint, either with the JWT bearer flow or with
 * client credentials, depending on the configured grant type.
 */
public class OAuthSessionProvider implements SessionProvider {
    private static final Logger log = LoggerFactory.getLogger(OAuthSessionProvider.class);

    static final String TOKEN_PATH = "/services/oauth2/token";
    private static final long JWT_TTL_MILLIS = 5 * 60 * 1000;

    private final WebClient webClient;
    private final SalesforceCredentials credentials;

    public OAuthSessionProvider(WebClient webClient, SalesforceCredentials credentials) {
        this.webClient = webClient;
        this.credentials = credentials;
    }

    @Override
    public SalesforceSession login() {
        SalesforceAccessToken token;
        if (credentials.isJwtGrant()) {
            log.info("Using JWT authentication");
            token = loginWithJWT();
        } else {
            log.info("Using OAuth2 client credentials authentication");
            token = loginWithClientCredentials();
        }
        if (token == null || token.accessToken == null) {
            throw new SalesforceLoginException("Token endpoint returned no access token");
        }
        log.info("Logged in to {}", token.instanceUrl);
        return token.toSession();
    }

    /**
     * JWT Bearer Token Flow, the same one the sf CLI uses for server-to-server logins.
     */
    private SalesforceAccessToken loginWithJWT() {
        PrivateKey privateKey = readPrivateKey(credentials.getJwtKeyFile());

        String jwt = Jwts.builder()
                .issuer(credentials.getClientId())                       // Connected App consumer key
                .subject(credentials.getUsername())
                .audience().add(credentials.getAudienceUrl()).and()      // login or test.salesforce.com
                .expiration(new Date(System.currentTimeMillis() + JWT_TTL_MILLIS))
                .signWith(privateKey)
                .compact();
        log.debug("Created JWT token for user: {}", credentials.getUsername());

        LinkedMultiValueMap<String, String> formData = new LinkedMultiValueMap<>();
        formData.add("grant_type", SalesforceCredentials.JWT_BEARER_GRANT);
        formData.add("assertion", jwt);
        return requestToken(formData);
    }

    private SalesforceAccessToken loginWithClientCredentials() {
        LinkedMultiValueMap<String, String> formData = new LinkedMultiValueMap<>();
        formData.add("grant_type", credentials.getGrantType());
        formData.add("client_id", credentials.getClientId());
        formData.add("client_secret", credentials.getClientSecret());
        return requestToken(formData);
    }

    private SalesforceAccessToken requestToken(LinkedMultiValueMap<String, String> formData) {
        String tokenUrl = stripTrailingSlash(credentials.getLoginUrl()) + TOKEN_PATH;
        try {
            return webClient
                    .post()
                    .uri(tokenUrl)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_FORM_URLENCODED_VALUE)
                    .body(BodyInserters.fromFormData(formData))
                    .accept(MediaType.APPLICATION_JSON)
                    .acceptCharset(StandardCharsets.UTF_8)
                    .retrieve()
                    .bodyToMono(SalesforceAccessToken.class)
                    .block();
        } catch (WebClientResponseException e) {
            log.error("Login failed with status {}: {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new SalesforceLoginException("Salesforce login failed with status " + e.getStatusCode(), e);
        }
    }

    /**
     * Reads an RSA private key from a PKCS#8 PEM file.
     */
    static PrivateKey readPrivateKey(String keyFilePath) {
        if (keyFilePath == null || keyFilePath.isEmpty()) {
            throw new IllegalArgumentException("JWT key file path is not configured");
        }
        Path keyPath = Paths.get(keyFilePath);
        String keyContent;
        try {
            keyContent = Files.readString(keyPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SalesforceLoginException("JWT key file could not be read: " + keyFilePath, e);
        }

        // Remove PEM headers/footers and whitespace
        keyContent = keyContent
                .replaceAll("-----BEGIN.*-----", "")
                .replaceAll("-----END.*-----", "")
                .replaceAll("\\s+", "");

        try {
            byte[] keyBytes = Base64.getDecoder().decode(keyContent);
            return KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(keyBytes));
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            log.error("Failed to read private key from {}: {}", keyFilePath, e.getMessage());
            throw new SalesforceLoginException("Invalid private key format. Ensure the file is in PKCS#8 PEM format.", e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
