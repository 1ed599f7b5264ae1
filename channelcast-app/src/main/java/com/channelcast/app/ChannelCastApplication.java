package com.channelcast.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ChannelCast application entry point.
 */
@SpringBootApplication
public class ChannelCastApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChannelCastApplication.class, args);
    }
}
