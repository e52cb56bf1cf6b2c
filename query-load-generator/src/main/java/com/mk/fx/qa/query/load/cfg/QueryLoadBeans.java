package com.mk.fx.qa.query.load.cfg;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.query.load.backend.SpanCountParser;
import com.mk.fx.qa.query.load.backend.TempoSearchClient;
import com.mk.fx.qa.query.load.backend.TraceSearchClient;
import com.mk.fx.qa.query.load.metrics.QueryLoadMetrics;
import com.mk.fx.qa.query.load.rest.LoadHttpClient;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the backend adapter and metrics sink the scheduler depends on. */
@Configuration
public class QueryLoadBeans {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public LoadHttpClient loadHttpClient(QueryLoadCfg cfg) {
    QueryLoadCfg.Tempo tempo = cfg.getTempo();
    String token = TempoSearchClient.readToken(tempo.getTokenPath()).orElse(null);

    Map<String, String> variables = new HashMap<>();
    if (tempo.getTenantId() != null) {
      variables.put(TempoSearchClient.TENANT_VARIABLE, tempo.getTenantId());
    }
    return new LoadHttpClient(
        tempo.getQueryEndpoint(),
        Duration.ofMillis(tempo.getConnectionTimeoutMs()),
        Duration.ofMillis(tempo.getRequestTimeoutMs()),
        tempo.isInsecureSkipVerify(),
        TempoSearchClient.gatewayHeaders(token, tempo.getTenantId()),
        variables);
  }

  @Bean
  public TraceSearchClient traceSearchClient(LoadHttpClient loadHttpClient, QueryLoadCfg cfg) {
    return new TempoSearchClient(
        loadHttpClient, cfg.getTempo().getSearchPath(), cfg.getTempo().getTimestampUnit());
  }

  @Bean
  public SpanCountParser spanCountParser(ObjectMapper objectMapper) {
    return new SpanCountParser(objectMapper);
  }

  @Bean
  public QueryLoadMetrics queryLoadMetrics(MeterRegistry meterRegistry, QueryLoadCfg cfg) {
    return new QueryLoadMetrics(meterRegistry, cfg.getNamespace());
  }
}
