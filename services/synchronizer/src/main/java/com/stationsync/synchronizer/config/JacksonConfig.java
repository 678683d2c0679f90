package com.stationsync.synchronizer.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stationsync.common.util.JsonUtil;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.web.reactive.config.WebFluxConfigurer;
import org.springframework.web.reactive.function.client.ExchangeStrategies;

/**
 * One Jackson mapper for the control API and for the outbound MLflow and ThingsBoard clients.
 */
@Configuration
public class JacksonConfig implements WebFluxConfigurer {

    // runs/search pages carry every param and tag of 100 runs
    private static final int MAX_CLIENT_BUFFER_BYTES = 16 * 1024 * 1024;

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return JsonUtil.getObjectMapper();
    }

    @Bean
    public ExchangeStrategies jsonExchangeStrategies() {
        ObjectMapper mapper = objectMapper();
        return ExchangeStrategies.builder()
                .codecs(codecs -> {
                    codecs.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder(mapper));
                    codecs.defaultCodecs().jackson2JsonDecoder(new Jackson2JsonDecoder(mapper));
                    codecs.defaultCodecs().maxInMemorySize(MAX_CLIENT_BUFFER_BYTES);
                })
                .build();
    }

    @Override
    public void configureHttpMessageCodecs(ServerCodecConfigurer configurer) {
        ObjectMapper mapper = objectMapper();
        configurer.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder(mapper));
        configurer.defaultCodecs().jackson2JsonDecoder(new Jackson2JsonDecoder(mapper));
    }
}
