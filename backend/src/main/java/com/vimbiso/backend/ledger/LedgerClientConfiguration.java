package com.vimbiso.backend.ledger;

import io.netty.channel.ChannelOption;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

@Configuration
@EnableConfigurationProperties(LedgerProperties.class)
public class LedgerClientConfiguration {

  static final String CLIENT_API_KEY_HEADER = "x-client-api-key";

  @Bean
  @Qualifier("ledgerWebClient")
  public WebClient ledgerWebClient(WebClient.Builder builder, LedgerProperties properties) {
    HttpClient httpClient =
        HttpClient.create()
            .option(
                ChannelOption.CONNECT_TIMEOUT_MILLIS,
                (int) properties.getConnectTimeout().toMillis())
            .responseTimeout(properties.getTimeout());
    WebClient.Builder configured =
        builder
            .clone()
            .baseUrl(properties.getBaseUrl())
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
    if (StringUtils.hasText(properties.getClientApiKey())) {
      configured.defaultHeader(CLIENT_API_KEY_HEADER, properties.getClientApiKey());
    }
    return configured.build();
  }
}
