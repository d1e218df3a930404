package com.example.fileaudit.remote;

import com.example.fileaudit.AuditConfig;
import com.example.fileaudit.ErrorKind;
import com.example.fileaudit.FileAuditException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Consumer;

public final class GraphRemoteLibrary implements RemoteLibrary {
    private static final Logger LOGGER = LoggerFactory.getLogger(GraphRemoteLibrary.class);
    private static final String GRAPH_BASE = "https://graph.microsoft.com/v1.0";
    private static final String LOGIN_BASE = "https://login.microsoftonline.com";
    private static final Duration TOKEN_REFRESH_MARGIN = Duration.ofMinutes(5);

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final String graphBase;
    private final String loginBase;
    private final String siteId;
    private final String tenantId;
    private final String clientId;
    private final String clientSecret;
    private final Duration requestTimeout;
    private final Clock clock;

    private AccessToken token;

    public GraphRemoteLibrary(AuditConfig.Remote settings, ObjectMapper mapper, Clock clock) {
        this(HttpClient.newBuilder()
                        .connectTimeout(settings.requestTimeout())
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build(),
                mapper,
                GRAPH_BASE,
                LOGIN_BASE,
                settings,
                clock);
    }

    GraphRemoteLibrary(HttpClient httpClient,
                       ObjectMapper mapper,
                       String graphBase,
                       String loginBase,
                       AuditConfig.Remote settings,
                       Clock clock) {
        if (!settings.isConfigured()) {
            throw new IllegalArgumentException("Remote library settings are incomplete (site, tenant, client id and secret).");
        }
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.graphBase = graphBase;
        this.loginBase = loginBase;
        this.siteId = settings.siteId().orElseThrow();
        this.tenantId = settings.tenantId().orElseThrow();
        this.clientId = settings.clientId().orElseThrow();
        this.clientSecret = settings.clientSecret().orElseThrow();
        this.requestTimeout = settings.requestTimeout();
        this.clock = clock;
    }

    @Override
    public void forEachItem(Consumer<RemoteItem> consumer) {
        String driveId = getJson(graphBase + "/sites/" + siteId + "/drive").path("id").asText(null);
        if (driveId == null) {
            throw new FileAuditException(ErrorKind.COLLABORATOR_FAILURE, "Site " + siteId + " has no document library.");
        }
        LOGGER.info("Scanning document library drive {}", driveId);
        String url = graphBase + "/drives/" + driveId + "/root/delta";
        while (url != null) {
            JsonNode page = getJson(url);
            for (JsonNode item : page.path("value")) {
                consumer.accept(RemoteItem.fromJson(item));
            }
            JsonNode next = page.get("@odata.nextLink");
            url = next == null || next.isNull() ? null : next.asText();
        }
    }

    @Override
    public InputStream openContent(String webUrl) {
        String url = graphBase + "/shares/" + SharingTokens.encode(webUrl) + "/driveItem/content";
        HttpRequest request = authorized(url).GET().build();
        HttpResponse<InputStream> response = send(request, HttpResponse.BodyHandlers.ofInputStream(), webUrl);
        if (response.statusCode() / 100 != 2) {
            closeQuietly(response.body(), webUrl);
            throw statusError(response.statusCode(), webUrl);
        }
        return response.body();
    }

    private JsonNode getJson(String url) {
        HttpResponse<String> response = send(authorized(url).GET().build(), HttpResponse.BodyHandlers.ofString(), url);
        if (response.statusCode() / 100 != 2) {
            throw statusError(response.statusCode(), url);
        }
        try {
            return mapper.readTree(response.body());
        } catch (IOException ex) {
            throw new FileAuditException(ErrorKind.COLLABORATOR_FAILURE, "Unreadable response from " + url, ex);
        }
    }

    private HttpRequest.Builder authorized(String url) {
        return HttpRequest.newBuilder(URI.create(url))
                .timeout(requestTimeout)
                .header("Authorization", "Bearer " + accessToken())
                .header("Accept", "application/json");
    }

    synchronized String accessToken() {
        Instant now = clock.instant();
        if (token != null && now.isBefore(token.expiresAt().minus(TOKEN_REFRESH_MARGIN))) {
            return token.value();
        }
        String form = "client_id=" + encode(clientId)
                + "&scope=" + encode("https://graph.microsoft.com/.default")
                + "&client_secret=" + encode(clientSecret)
                + "&grant_type=client_credentials";
        String url = loginBase + "/" + tenantId + "/oauth2/v2.0/token";
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .timeout(requestTimeout)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(form))
                .build();
        HttpResponse<String> response = send(request, HttpResponse.BodyHandlers.ofString(), "token endpoint");
        if (response.statusCode() / 100 != 2) {
            // The token endpoint answers bad credentials with 400/401.
            throw new FileAuditException(ErrorKind.COLLABORATOR_UNAUTHORIZED,
                    "Remote library sign-in failed (HTTP " + response.statusCode() + "). Check the Graph client credentials.");
        }
        try {
            JsonNode json = mapper.readTree(response.body());
            token = new AccessToken(json.path("access_token").asText(), now.plusSeconds(json.path("expires_in").asLong(3600)));
        } catch (IOException ex) {
            throw new FileAuditException(ErrorKind.COLLABORATOR_FAILURE, "Unreadable token response", ex);
        }
        return token.value();
    }

    private <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler, String target) {
        try {
            return httpClient.send(request, handler);
        } catch (HttpTimeoutException ex) {
            throw new FileAuditException(ErrorKind.COLLABORATOR_TIMEOUT,
                    "Remote library did not answer in time for " + target + ". Try again later.", ex);
        } catch (IOException ex) {
            throw new FileAuditException(ErrorKind.COLLABORATOR_FAILURE,
                    "Remote library request failed for " + target + ": " + ex.getMessage(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new FileAuditException(ErrorKind.COLLABORATOR_FAILURE, "Interrupted while calling the remote library", ex);
        }
    }

    static FileAuditException statusError(int status, String target) {
        return switch (status) {
            case 401 -> new FileAuditException(ErrorKind.COLLABORATOR_UNAUTHORIZED,
                    "Remote library rejected the access token. Check the Graph app registration.");
            case 403 -> new FileAuditException(ErrorKind.COLLABORATOR_FORBIDDEN,
                    "Access to " + target + " is forbidden. Grant the app Sites.Read.All or share the item.");
            case 404 -> new FileAuditException(ErrorKind.COLLABORATOR_NOT_FOUND,
                    "Item not found in the remote library: " + target);
            case 429 -> new FileAuditException(ErrorKind.COLLABORATOR_RATE_LIMITED,
                    "Remote library is throttling requests. Try again shortly.");
            case 504 -> new FileAuditException(ErrorKind.COLLABORATOR_TIMEOUT,
                    "Remote library timed out serving " + target + ". Try again later.");
            default -> new FileAuditException(ErrorKind.COLLABORATOR_FAILURE,
                    "Remote library request for " + target + " failed with HTTP " + status + ".");
        };
    }

    private static void closeQuietly(InputStream body, String target) {
        try {
            body.close();
        } catch (IOException ex) {
            LOGGER.debug("Failed to close error body for {}", target, ex);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private record AccessToken(String value, Instant expiresAt) {
    }
}
