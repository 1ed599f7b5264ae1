package com.channelcast.app;

import com.channelcast.app.commands.CommandProcessor;
import com.channelcast.app.commands.CommandResult;
import com.channelcast.common.config.ChannelCastConfig;
import com.channelcast.gateway.cron.JobScheduler;
import com.channelcast.gateway.cron.SchedulerSettings;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE,
        properties = "channelcast.config.path=src/test/resources/app-test-config.json")
class ChannelCastApplicationTest {

    @Autowired
    ChannelCastConfig config;

    @Autowired
    SchedulerSettings settings;

    @Autowired
    JobScheduler scheduler;

    @Autowired
    CommandProcessor processor;

    @Test
    void contextLoads_withConfigFromFile() {
        assertEquals("test-token", config.getAdmin().getToken());
        assertEquals(List.of("-1001", "-1002"), settings.getDefaultChannelIds());
    }

    @Test
    void commandsAreWiredToTheScheduler() {
        CommandResult result = processor.handleCommand("/help", null, config);
        assertNotNull(result);
        assertFalse(result.error());
        assertNotNull(scheduler.armedJobIds());
    }
}
