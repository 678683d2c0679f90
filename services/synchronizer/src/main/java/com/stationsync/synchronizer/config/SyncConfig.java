package com.stationsync.synchronizer.config;

import com.stationsync.synchronizer.support.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SyncConfig {

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }
}
