package dev.repowarden.infrastructure.github;

import com.fasterxml.jackson.databind.JsonNode;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import dev.repowarden.config.GitHubProperties;
import dev.repowarden.exception.PermanentPlatformException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.interfaces.RSAPrivateKey;
import java.security.spec.KeySpec;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.RSAPrivateCrtKeySpec;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * GitHub App authentication: an RS256 JWT signed with the app key is exchanged for
 * an installation token, cached until five minutes before it expires.
 */
@Component
public class GitHubTokenProvider {
    private static final Logger log = LoggerFactory.getLogger(GitHubTokenProvider.class);
    private static final long REFRESH_MARGIN_SECONDS = 300;

    private final GitHubProperties properties;
    private final WebClient webClient;
    private final RSAPrivateKey privateKey;
    private final Map<Long, CachedToken> cache = new ConcurrentHashMap<>();
    private volatile String appLogin;

    public GitHubTokenProvider(GitHubProperties properties, WebClient.Builder builder) {
        this.properties = properties;
        this.webClient = builder.clone().baseUrl(properties.apiBaseUrl()).build();
        this.privateKey = parsePrivateKey(properties.privateKey());
    }

    public String getInstallationToken(long installationId) {
        CachedToken cached = cache.get(installationId);
        if (cached != null && cached.expiresAt().isAfter(Instant.now().plusSeconds(REFRESH_MARGIN_SECONDS))) {
            return cached.token();
        }

        JsonNode response;
        try {
            response = webClient.post()
                    .uri("/app/installations/{installationId}/access_tokens", installationId)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + appJwt())
                    .header(HttpHeaders.ACCEPT, "application/vnd.github+json")
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block();
        } catch (RuntimeException e) {
            throw GitHubErrors.translate("Installation token for " + installationId, e);
        }
        if (response == null || !response.hasNonNull("token")) {
            throw new PermanentPlatformException("No installation token returned for installation " + installationId);
        }

        CachedToken token = new CachedToken(response.get("token").asText(),
                Instant.parse(response.path("expires_at").asText(Instant.now().plusSeconds(3600).toString())));
        cache.put(installationId, token);
        log.info("Obtained installation token for installation {} (expires {})", installationId, token.expiresAt());
        return token.token();
    }

    /**
     * Login the app writes comments under, {@code <slug>[bot]}. Read once from
     * {@code GET /app} with the app JWT.
     */
    public String appLogin() {
        String login = appLogin;
        if (login != null) return login;

        JsonNode app;
        try {
            app = webClient.get()
                    .uri("/app")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + appJwt())
                    .header(HttpHeaders.ACCEPT, "application/vnd.github+json")
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block();
        } catch (RuntimeException e) {
            throw GitHubErrors.translate("App identity", e);
        }
        if (app == null || !app.hasNonNull("slug")) {
            throw new PermanentPlatformException("No slug returned for GitHub App " + properties.appId());
        }
        login = app.get("slug").asText() + "[bot]";
        appLogin = login;
        log.info("GitHub App {} comments as {}", properties.appId(), login);
        return login;
    }

    /** Drops a cached token, e.g. after GitHub answered 401 with it. */
    public void evict(long installationId) {
        cache.remove(installationId);
    }

    String appJwt() {
        if (privateKey == null) {
            throw new PermanentPlatformException("GitHub App private key is not configured");
        }
        Instant now = Instant.now();
        JWTClaimsSet claims = new JWTClaimsSet.Builder()
                .issuer(String.valueOf(properties.appId()))
                .issueTime(Date.from(now.minusSeconds(60)))
                .expirationTime(Date.from(now.plusSeconds(540)))
                .build();
        SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.RS256), claims);
        try {
            jwt.sign(new RSASSASigner(privateKey));
        } catch (JOSEException e) {
            throw new IllegalStateException("Failed to sign GitHub App JWT", e);
        }
        return jwt.serialize();
    }

    static RSAPrivateKey parsePrivateKey(String pem) {
        if (pem == null || pem.isBlank()) {
            log.warn("GitHub App private key not configured, platform calls will fail");
            return null;
        }
        String base64 = pem.replaceAll("-----(BEGIN|END) (RSA )?PRIVATE KEY-----", "").replaceAll("\\s", "");
        byte[] der = Base64.getDecoder().decode(base64);
        KeySpec spec = pem.contains("BEGIN RSA PRIVATE KEY") ? Pkcs1.read(der) : new PKCS8EncodedKeySpec(der);
        try {
            return (RSAPrivateKey) KeyFactory.getInstance("RSA").generatePrivate(spec);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to parse GitHub App private key", e);
        }
    }

    /**
     * Minimal DER reader for PKCS#1 RSAPrivateKey, the format GitHub issues app keys in.
     * SEQUENCE { version, n, e, d, p, q, dP, dQ, qInv }
     */
    static final class Pkcs1 {
        private final ByteBuffer der;

        private Pkcs1(byte[] der) {
            this.der = ByteBuffer.wrap(der);
        }

        static RSAPrivateCrtKeySpec read(byte[] der) {
            Pkcs1 reader = new Pkcs1(der);
            reader.header();
            reader.integer();
            return new RSAPrivateCrtKeySpec(reader.integer(), reader.integer(), reader.integer(),
                    reader.integer(), reader.integer(), reader.integer(), reader.integer(), reader.integer());
        }

        private int header() {
            der.get();
            int first = der.get() & 0xFF;
            if (first < 0x80) return first;
            int length = 0;
            for (int i = 0; i < (first & 0x7F); i++) {
                length = (length << 8) | (der.get() & 0xFF);
            }
            return length;
        }

        private BigInteger integer() {
            byte[] value = new byte[header()];
            der.get(value);
            return new BigInteger(value);
        }
    }

    private record CachedToken(String token, Instant expiresAt) {}
}
