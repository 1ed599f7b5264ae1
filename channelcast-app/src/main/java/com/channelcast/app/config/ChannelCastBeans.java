package com.channelcast.app.config;

import com.channelcast.channel.ChannelDeliveryException;
import com.channelcast.channel.ChannelTransport;
import com.channelcast.channel.telegram.TelegramTransport;
import com.channelcast.common.config.ChannelCastConfig;
import com.channelcast.common.config.ConfigService;
import com.channelcast.gateway.audit.ContentIdentity;
import com.channelcast.gateway.audit.DeliveryAuditor;
import com.channelcast.gateway.content.ContentResolver;
import com.channelcast.gateway.content.PayloadContentResolver;
import com.channelcast.gateway.content.TemplateCatalog;
import com.channelcast.gateway.cron.ExecutorTriggerTimers;
import com.channelcast.gateway.cron.JobScheduler;
import com.channelcast.gateway.cron.JobSeedImporter;
import com.channelcast.gateway.cron.SchedulerSettings;
import com.channelcast.gateway.cron.SpringCronTrigger;
import com.channelcast.gateway.job.JobStore;
import com.channelcast.gateway.job.JsonFileJobStore;
import com.channelcast.gateway.job.RetryPolicy;
import com.channelcast.gateway.ledger.DeliveryLedger;
import com.channelcast.gateway.ledger.JsonlDeliveryLedger;
import com.channelcast.gateway.outbound.DeliveryFanout;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Wires the scheduling, delivery and audit core from the JSON config file.
 * <p>
 * Config is read once at startup; changes to scheduler or delivery sections
 * need a restart. Command handlers reload it per request.
 */
@Slf4j
@Configuration
public class ChannelCastBeans {

    @Bean
    public ConfigService configService(
            @Value("${channelcast.config.path:~/.channelcast/config.json}") String configPath) {
        return new ConfigService(ConfigService.expandHome(configPath));
    }

    @Bean
    public ChannelCastConfig channelCastConfig(ConfigService configService) {
        return configService.loadConfig();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public JobStore jobStore(ChannelCastConfig config, Clock clock) {
        return new JsonFileJobStore(dataDir(config).resolve("jobs.json"), clock);
    }

    @Bean
    public DeliveryLedger deliveryLedger(ChannelCastConfig config) {
        return new JsonlDeliveryLedger(dataDir(config).resolve("deliveries.jsonl"));
    }

    @Bean
    public ChannelTransport channelTransport(ChannelCastConfig config) {
        ChannelCastConfig.TelegramConfig telegram = config.getTelegram();
        if (telegram.getBotToken() == null || telegram.getBotToken().isBlank()) {
            log.warn("telegram.botToken is not configured; every delivery attempt will fail");
            return (channelId, text) -> {
                throw new ChannelDeliveryException(channelId, "telegram bot token not configured");
            };
        }
        return new TelegramTransport(telegram.getBotToken(), telegram.getApiBaseUrl(),
                telegram.getParseMode(), Duration.ofSeconds(telegram.getTimeoutSeconds()));
    }

    @Bean(destroyMethod = "close")
    public DeliveryFanout deliveryFanout(ChannelTransport transport, DeliveryLedger ledger,
            ChannelCastConfig config) {
        return new DeliveryFanout(transport, ledger, config.getDelivery().getMaxConcurrency());
    }

    @Bean
    public ContentResolver contentResolver() throws IOException {
        // No generator or market source is bundled. Seeds that need one publish their fallback text.
        return new PayloadContentResolver(null, null, TemplateCatalog.fromResource("templates.json"));
    }

    @Bean
    public SchedulerSettings schedulerSettings(ChannelCastConfig config) {
        ChannelCastConfig.DeliveryConfig delivery = config.getDelivery();
        return SchedulerSettings.builder()
                .defaultZone(ZoneId.of(config.getScheduler().getDefaultTimezone()))
                .defaultChannelIds(config.getChannels().getDefaultIds())
                .footer(config.getScheduler().getFooter())
                .defaultRetryPolicy(new RetryPolicy(delivery.getDefaultRetries(), delivery.getDefaultBackoffSec()))
                .build();
    }

    @Bean(destroyMethod = "close")
    public JobScheduler jobScheduler(JobStore store, ContentResolver resolver, DeliveryFanout fanout,
            SchedulerSettings settings, ChannelCastConfig config) {
        return new JobScheduler(store, resolver, fanout, new SpringCronTrigger(),
                new ExecutorTriggerTimers(config.getScheduler().getThreads()), settings);
    }

    @Bean
    public JobSeedImporter jobSeedImporter(JobScheduler scheduler, JobStore store) {
        return new JobSeedImporter(scheduler, store);
    }

    @Bean
    public DeliveryAuditor deliveryAuditor(DeliveryLedger ledger, ChannelCastConfig config) {
        ChannelCastConfig.AuditConfig audit = config.getAudit();
        return new DeliveryAuditor(ledger, ContentIdentity.fromConfig(audit.getIdentity(), audit.getPrefixLength()));
    }

    private static Path dataDir(ChannelCastConfig config) {
        return ConfigService.expandHome(config.getScheduler().getDataDir());
    }
}
