package dev.repowarden;

import dev.repowarden.classifier.ClassifierRegistry;
import dev.repowarden.domain.enums.ClassifierType;
import dev.repowarden.domain.enums.IssueState;
import dev.repowarden.platform.EffectStatus;
import dev.repowarden.platform.PlatformTarget;
import dev.repowarden.platform.RepositoryPlatform;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Boots the full context with the platform mocked and drives a signed webhook
 * through the controller, the async listener and the pipeline.
 */
@SpringBootTest
@AutoConfigureMockMvc
@TestPropertySource(properties = "repowarden.github.webhook-secret=" + RepoWardenApplicationTest.SECRET)
class RepoWardenApplicationTest {

    static final String SECRET = "integration-secret";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ClassifierRegistry classifierRegistry;

    @MockitoBean
    private RepositoryPlatform platform;

    @Test
    @DisplayName("every classifier is registered")
    void registersClassifiers() {
        assertThat(classifierRegistry.registeredTypes()).containsExactly(ClassifierType.values());
    }

    @Test
    @DisplayName("a signed /close comment closes the issue asynchronously")
    void closeCommandEndToEnd() throws Exception {
        when(platform.closeOrReopen(any(), eq(IssueState.CLOSED))).thenReturn(EffectStatus.APPLIED);
        when(platform.postComment(any(), any())).thenReturn(EffectStatus.APPLIED);
        String body = """
                {
                  "action": "created",
                  "issue": { "number": 7, "title": "Old bug" },
                  "comment": { "id": 321, "body": "/close", "user": { "login": "maintainer", "type": "User" } },
                  "repository": { "full_name": "octocat/hello-world" },
                  "installation": { "id": 12345 },
                  "sender": { "login": "maintainer", "type": "User" }
                }
                """;

        mockMvc.perform(post("/webhooks/github")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-GitHub-Event", "issue_comment")
                        .header("X-GitHub-Delivery", "delivery-e2e")
                        .header("X-Hub-Signature-256", sign(body))
                        .content(body))
                .andExpect(status().isAccepted());

        verify(platform, timeout(5_000)).closeOrReopen(
                argThat((PlatformTarget t) -> t.number() == 7 && t.installationId() == 12345L),
                eq(IssueState.CLOSED));
        verify(platform, timeout(5_000)).postComment(any(), contains("Closed by @maintainer"));
    }

    @Test
    @DisplayName("health is public while other actuator endpoints are hidden")
    void actuatorExposure() throws Exception {
        mockMvc.perform(get("/actuator/health")).andExpect(status().isOk());
        mockMvc.perform(get("/actuator/metrics")).andExpect(status().isNotFound());
        mockMvc.perform(get("/webhooks/github")).andExpect(status().isNotFound());
    }

    private static String sign(String body) throws Exception {
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(SECRET.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        return "sha256=" + HexFormat.of().formatHex(mac.doFinal(body.getBytes(StandardCharsets.UTF_8)));
    }
}
