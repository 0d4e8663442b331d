package dev.repowarden;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * RepoWarden: GitHub App that labels, triages and answers slash commands.
 *
 * <pre>
 * GitHub Webhook → WebhookController → DeliveryReceivedEvent → DeliveryListener (@Async)
 *   → EventPipeline → EventRouter → {Classifiers | CommandParser} → ActionPlanner
 *   → ActionDispatcher → GitHubApiClient
 * </pre>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableAsync
public class RepoWardenApplication {

    public static void main(String[] args) {
        SpringApplication.run(RepoWardenApplication.class, args);
    }
}
