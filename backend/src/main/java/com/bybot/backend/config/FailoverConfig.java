package com.bybot.backend.config;

import com.bybot.backend.service.MetricsService;
import com.bybot.backend.service.exchange.ResilientExchangeClient;
import com.bybot.backend.service.failover.ComponentProbe;
import com.bybot.backend.service.failover.FailoverManager;
import com.bybot.backend.service.failover.Notifier;
import com.bybot.backend.service.failover.probe.ApiClientProbe;
import com.bybot.backend.service.failover.probe.DataStreamProbe;
import com.bybot.backend.service.failover.probe.MarketDataStream;
import com.bybot.backend.service.failover.probe.OrderEngine;
import com.bybot.backend.service.failover.probe.OrderEngineProbe;
import com.bybot.backend.service.failover.probe.PersistenceProbe;
import com.bybot.backend.service.failover.probe.StrategyEngine;
import com.bybot.backend.service.failover.probe.StrategyEngineProbe;
import com.bybot.backend.service.lifecycle.ApplicationShutdownHandler;
import com.bybot.backend.service.metrics.MetricsSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

@Slf4j
@Configuration
public class FailoverConfig {

    @Bean
    public ApplicationShutdownHandler applicationShutdownHandler(ConfigurableApplicationContext context,
                                                                 FailoverProperties properties) {
        return new ApplicationShutdownHandler(context, properties.isExitJvmOnShutdown());
    }

    /**
     * The market stream, strategy and order engines belong to the trading side; their probes are
     * only registered when those beans exist.
     */
    @Bean
    public FailoverManager failoverManager(FailoverProperties properties,
                                           ResilientExchangeClient resilientExchangeClient,
                                           MetricsSink metricsSink,
                                           ObjectProvider<MarketDataStream> marketDataStream,
                                           ObjectProvider<StrategyEngine> strategyEngine,
                                           ObjectProvider<OrderEngine> orderEngine,
                                           Notifier notifier,
                                           ApplicationShutdownHandler shutdownHandler,
                                           MetricsService metricsService,
                                           @Qualifier("failoverExecutor") Executor failoverExecutor,
                                           Clock clock) {
        List<ComponentProbe> probes = new ArrayList<>();
        probes.add(new ApiClientProbe(resilientExchangeClient));
        probes.add(new PersistenceProbe(metricsSink));
        marketDataStream.ifAvailable(stream ->
                probes.add(new DataStreamProbe(stream, clock, properties.getDataStreamStaleAfter())));
        strategyEngine.ifAvailable(engine ->
                probes.add(new StrategyEngineProbe(engine, clock, properties.getStrategySignalTimeout())));
        orderEngine.ifAvailable(engine -> probes.add(new OrderEngineProbe(engine)));
        return new FailoverManager(properties.toSettings(), probes, notifier, shutdownHandler,
                metricsService, failoverExecutor, clock);
    }
}
