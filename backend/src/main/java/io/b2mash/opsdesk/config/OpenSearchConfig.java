package io.b2mash.opsdesk.config;

import java.net.URI;
import java.time.Duration;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.util.Timeout;
import org.opensearch.client.json.jackson.JacksonJsonpMapper;
import org.opensearch.client.opensearch.OpenSearchClient;
import org.opensearch.client.transport.httpclient5.ApacheHttpClient5TransportBuilder;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(OpenSearchConfig.SearchIndexProperties.class)
public class OpenSearchConfig {

  @ConfigurationProperties("opsdesk.search")
  public record SearchIndexProperties(
      String url,
      String index,
      Duration connectTimeout,
      Duration responseTimeout,
      int maxScan) {

    public SearchIndexProperties {
      url = url == null || url.isBlank() ? "http://localhost:9200" : url;
      index = index == null || index.isBlank() ? "opsdesk-records" : index;
      connectTimeout = connectTimeout == null ? Duration.ofSeconds(1) : connectTimeout;
      responseTimeout = responseTimeout == null ? Duration.ofSeconds(2) : responseTimeout;
      maxScan = maxScan <= 0 ? 5000 : maxScan;
    }
  }

  @Bean
  OpenSearchClient openSearchClient(SearchIndexProperties properties) {
    var uri = URI.create(properties.url());
    int port = uri.getPort() > 0 ? uri.getPort() : 9200;
    var host = new HttpHost(uri.getScheme(), uri.getHost(), port);

    var transport =
        ApacheHttpClient5TransportBuilder.builder(host)
            .setMapper(new JacksonJsonpMapper())
            .setRequestConfigCallback(
                requestConfig ->
                    requestConfig
                        .setConnectTimeout(Timeout.of(properties.connectTimeout()))
                        .setResponseTimeout(Timeout.of(properties.responseTimeout())))
            .build();
    return new OpenSearchClient(transport);
  }
}
