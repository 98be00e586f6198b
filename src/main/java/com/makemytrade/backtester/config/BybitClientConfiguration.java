package com.makemytrade.backtester.config;

import com.bybit.api.client.config.BybitApiConfig;
import com.bybit.api.client.restApi.BybitApiMarketRestClient;
import com.bybit.api.client.service.BybitApiClientFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class BybitClientConfiguration {

    @Bean
    public BybitApiMarketRestClient bybitMarketClient() {
        return BybitApiClientFactory.newInstance(BybitApiConfig.MAINNET_DOMAIN, false).newMarketDataRestClient();
    }
}
