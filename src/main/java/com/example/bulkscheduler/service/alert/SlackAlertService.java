package com.example.bulkscheduler.service.alert;

import com.example.bulkscheduler.config.SlackProperties;
import com.example.bulkscheduler.domain.entity.ScheduledJob;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Service for sending operational alerts to Slack.
 * <p>
 * Covers failure streaks of scheduled jobs, emergency stops and
 * generic scheduler errors. Alert delivery never affects job execution.
 */
@Slf4j
@Service
public class SlackAlertService {

    private final SlackProperties slackProperties;
    private final Slack slack;

    @Value("${spring.application.name:bulk-generation-scheduler}")
    private String applicationName;

    public SlackAlertService(SlackProperties slackProperties) {
        this(slackProperties, Slack.getInstance());
    }

    SlackAlertService(SlackProperties slackProperties, Slack slack) {
        this.slackProperties = slackProperties;
        this.slack = slack;
    }

    /**
     * Send alert when a job reaches the configured number of consecutive failures.
     * Runs asynchronously to not block job execution.
     */
    @Async
    public void sendFailureStreakAlert(ScheduledJob job, int consecutiveFailures, String lastError) {
        if (!isConfigured()) {
            log.warn("Slack alerting is disabled or webhook URL not configured. Job {} has failed {} times in a row but no alert was sent.",
                    job.getId(), consecutiveFailures);
            return;
        }

        try {
            var payload = buildFailureStreakPayload(job, consecutiveFailures, lastError);
            var response = slack.send(slackProperties.getWebhookUrl(), payload);

            if (response.getCode() != 200) {
                log.error("Failed to send Slack alert. Response code: {}, body: {}", response.getCode(), response.getBody());
            } else {
                log.info("Slack alert sent for job {} failure streak ({})", job.getId(), consecutiveFailures);
            }
        } catch (Exception e) {
            log.error("Error sending Slack alert for job {}: {}", job.getId(), e.getMessage(), e);
        }
    }

    /**
     * Send alert after all timers were stopped by an operator
     */
    @Async
    public void sendEmergencyStopAlert(int stoppedCount) {
        if (!isConfigured()) {
            log.warn("Slack alerting disabled. Emergency stop alert not sent ({} timers stopped)", stoppedCount);
            return;
        }

        try {
            var payload = Payload.builder()
                    .channel(slackProperties.getChannel())
                    .username(applicationName)
                    .iconEmoji(":octagonal_sign:")
                    .text(":octagonal_sign: *Emergency Stop - All Scheduled Jobs Halted*")
                    .attachments(List.of(
                            Attachment.builder()
                                    .color("danger")
                                    .fields(List.of(
                                            Field.builder()
                                                    .title("Timers Stopped")
                                                    .value(String.valueOf(stoppedCount))
                                                    .valueShortEnough(true)
                                                    .build()
                                    ))
                                    .footer(applicationName + " | Jobs stay stopped until the next restart or edit")
                                    .ts(String.valueOf(Instant.now().getEpochSecond()))
                                    .build()
                    ))
                    .build();

            slack.send(slackProperties.getWebhookUrl(), payload);
        } catch (Exception e) {
            log.error("Error sending Slack emergency stop alert: {}", e.getMessage(), e);
        }
    }

    /**
     * Send generic error alert
     */
    @Async
    public void sendErrorAlert(String title, String message, String details) {
        if (!isConfigured()) {
            log.warn("Slack alerting disabled. Error alert not sent: {}", title);
            return;
        }

        try {
            var payload = Payload.builder()
                    .channel(slackProperties.getChannel())
                    .username(applicationName)
                    .iconEmoji(":warning:")
                    .text(":warning: *" + title + "*")
                    .attachments(List.of(
                            Attachment.builder()
                                    .color("warning")
                                    .text(message)
                                    .fields(details != null ? List.of(
                                            Field.builder()
                                                    .title("Details")
                                                    .value(truncate(details, 500))
                                                    .valueShortEnough(false)
                                                    .build()
                                    ) : List.of())
                                    .footer(applicationName)
                                    .ts(String.valueOf(Instant.now().getEpochSecond()))
                                    .build()
                    ))
                    .build();

            slack.send(slackProperties.getWebhookUrl(), payload);
        } catch (Exception e) {
            log.error("Error sending Slack error alert: {}", e.getMessage(), e);
        }
    }

    Payload buildFailureStreakPayload(ScheduledJob job, int consecutiveFailures, String lastError) {
        var jobId = String.valueOf(job.getId());

        return Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(":rotating_light:")
                .text(":rotating_light: *Scheduled Job Failing Repeatedly*")
                .attachments(List.of(
                        Attachment.builder()
                                .color("danger")
                                .title(job.getName())
                                .titleLink(buildJobLink(jobId))
                                .fields(Arrays.asList(
                                        Field.builder()
                                                .title("Job ID")
                                                .value(jobId)
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Schedule")
                                                .value(job.describeSchedule())
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Consecutive Failures")
                                                .value(String.valueOf(consecutiveFailures))
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Niches")
                                                .value(String.join(", ", job.getSelectedNiches()))
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Last Error")
                                                .value("```" + truncate(lastError != null ? lastError : "Unknown error", 400) + "```")
                                                .valueShortEnough(false)
                                                .build()
                                ))
                                .footer(applicationName + " | The job stays active and will fire again on schedule")
                                .ts(String.valueOf(Instant.now().getEpochSecond()))
                                .build()
                ))
                .build();
    }

    private boolean isConfigured() {
        return slackProperties.isEnabled()
                && slackProperties.getWebhookUrl() != null
                && !slackProperties.getWebhookUrl().isBlank();
    }

    private String buildJobLink(String jobId) {
        return slackProperties.getDashboardBaseUrl() + "/api/admin/jobs/" + jobId;
    }

    private String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
