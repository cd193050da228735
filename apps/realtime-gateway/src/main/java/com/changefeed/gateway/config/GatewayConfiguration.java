package com.changefeed.gateway.config;

import com.changefeed.gateway.auth.AccessPolicy;
import com.changefeed.gateway.auth.AccessProperties;
import com.changefeed.gateway.auth.CredentialValidator;
import com.changefeed.gateway.auth.DefaultAccessPolicy;
import com.changefeed.gateway.auth.JwtClaimsMapper;
import com.changefeed.gateway.auth.JwtCredentialValidator;
import com.changefeed.gateway.connection.ConnectionManager;
import com.changefeed.gateway.connection.ConnectionProperties;
import com.changefeed.gateway.connection.ResumeSessionStore;
import com.changefeed.gateway.connection.ResumeTokenService;
import com.changefeed.gateway.dispatch.DispatchProperties;
import com.changefeed.gateway.dispatch.FanOutDispatcher;
import com.changefeed.gateway.protocol.ClientMessageParser;
import com.changefeed.gateway.protocol.ServerMessageCodec;
import com.changefeed.gateway.registry.SubscriptionRegistry;
import com.changefeed.infra.eventlog.DurableEventLog;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.oauth2.jwt.JwtDecoder;

@Configuration
public class GatewayConfiguration {
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public ServerMessageCodec serverMessageCodec(ObjectMapper objectMapper) {
    return new ServerMessageCodec(objectMapper);
  }

  @Bean
  public ClientMessageParser clientMessageParser(
      ObjectMapper objectMapper, ConnectionProperties connectionProperties) {
    return new ClientMessageParser(objectMapper, connectionProperties.getMaxFrameLength());
  }

  @Bean
  public SubscriptionRegistry subscriptionRegistry(DispatchProperties dispatchProperties) {
    return new SubscriptionRegistry(Math.max(1, dispatchProperties.getWorkers()));
  }

  @Bean
  public AccessPolicy accessPolicy(AccessProperties accessProperties) {
    return new DefaultAccessPolicy(accessProperties);
  }

  @Bean
  public JwtClaimsMapper jwtClaimsMapper(AccessProperties accessProperties) {
    return new JwtClaimsMapper(accessProperties.getClientId(), accessProperties.getAttributeClaims());
  }

  @Bean
  public CredentialValidator credentialValidator(
      JwtDecoder jwtDecoder, JwtClaimsMapper jwtClaimsMapper, Clock clock) {
    return new JwtCredentialValidator(jwtDecoder, jwtClaimsMapper, clock);
  }

  @Bean
  public ResumeTokenService resumeTokenService(ConnectionProperties connectionProperties) {
    return new ResumeTokenService(connectionProperties.getResumeSecret());
  }

  @Bean
  public ResumeSessionStore resumeSessionStore(
      ConnectionProperties connectionProperties, Clock clock) {
    return new ResumeSessionStore(connectionProperties.getResumeSessionTtl(), clock);
  }

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService connectionSenderExecutor(ConnectionProperties connectionProperties) {
    return new ThreadPoolExecutor(
        Math.max(1, connectionProperties.getSenderThreads()),
        Integer.MAX_VALUE,
        60L,
        TimeUnit.SECONDS,
        new SynchronousQueue<>(),
        namedDaemonThreads("conn-sender-"));
  }

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService credentialValidationExecutor() {
    ThreadPoolExecutor executor =
        new ThreadPoolExecutor(
            4,
            4,
            60L,
            TimeUnit.SECONDS,
            new LinkedBlockingQueue<>(1_000),
            namedDaemonThreads("credential-check-"));
    executor.allowCoreThreadTimeOut(true);
    return executor;
  }

  @Bean(destroyMethod = "shutdown")
  public ConnectionManager connectionManager(
      SubscriptionRegistry subscriptionRegistry,
      CredentialValidator credentialValidator,
      ResumeTokenService resumeTokenService,
      ResumeSessionStore resumeSessionStore,
      ClientMessageParser clientMessageParser,
      ServerMessageCodec serverMessageCodec,
      ConnectionProperties connectionProperties,
      @Qualifier("connectionSenderExecutor") ExecutorService connectionSenderExecutor,
      @Qualifier("credentialValidationExecutor") ExecutorService credentialValidationExecutor,
      DurableEventLog durableEventLog,
      MeterRegistry meterRegistry,
      Clock clock) {
    return new ConnectionManager(
        subscriptionRegistry,
        credentialValidator,
        resumeTokenService,
        resumeSessionStore,
        clientMessageParser,
        serverMessageCodec,
        connectionProperties,
        connectionSenderExecutor,
        credentialValidationExecutor,
        durableEventLog::headOffset,
        meterRegistry,
        clock);
  }

  @Bean
  public FanOutDispatcher fanOutDispatcher(
      DurableEventLog durableEventLog,
      SubscriptionRegistry subscriptionRegistry,
      ConnectionManager connectionManager,
      AccessPolicy accessPolicy,
      DispatchProperties dispatchProperties,
      MeterRegistry meterRegistry) {
    return new FanOutDispatcher(
        durableEventLog,
        subscriptionRegistry,
        connectionManager,
        accessPolicy,
        dispatchProperties,
        meterRegistry);
  }

  private static ThreadFactory namedDaemonThreads(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
