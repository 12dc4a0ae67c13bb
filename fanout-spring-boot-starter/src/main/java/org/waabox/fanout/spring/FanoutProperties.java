package org.waabox.fanout.spring;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.waabox.fanout.ChangeChannels;
import org.waabox.fanout.relay.RelayNotifier;

/**
 * Configuration properties for change-notification fan-out, mapped from the
 * {@code fanout.*} prefix in application.yml or application.properties.
 *
 * <p>Supports:
 * <ul>
 *   <li>{@code fanout.prefer-relay} - consume through the relay when it is
 *       reachable, defaults to true.</li>
 *   <li>{@code fanout.channels} - the channels to listen on, defaults to
 *       the built-in change channels.</li>
 *   <li>{@code fanout.retry.*} - reconnection backoff.</li>
 *   <li>{@code fanout.source.*} - the PostgreSQL source store.</li>
 *   <li>{@code fanout.relay.kafka.*} - the Kafka relay.</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "fanout")
public class FanoutProperties {

  /** Whether the relay is the preferred transport. */
  private boolean preferRelay = true;

  /** The channels to listen on. */
  private List<String> channels = new ArrayList<>(ChangeChannels.DEFAULT);

  /** The reconnection backoff. */
  private final Retry retry = new Retry();

  /** The source store connection. */
  private final Source source = new Source();

  /** The relay connection. */
  private final Relay relay = new Relay();

  public boolean isPreferRelay() {
    return preferRelay;
  }

  public void setPreferRelay(final boolean thePreferRelay) {
    preferRelay = thePreferRelay;
  }

  public List<String> getChannels() {
    return channels;
  }

  public void setChannels(final List<String> theChannels) {
    channels = theChannels;
  }

  public Retry getRetry() {
    return retry;
  }

  public Source getSource() {
    return source;
  }

  public Relay getRelay() {
    return relay;
  }

  /** Reconnection backoff, bound from {@code fanout.retry}. */
  public static class Retry {

    /** The wait before the first retry. */
    private Duration initialBackoff = Duration.ofSeconds(5);

    /** The upper bound of the doubling wait. */
    private Duration maxBackoff = Duration.ofSeconds(30);

    public Duration getInitialBackoff() {
      return initialBackoff;
    }

    public void setInitialBackoff(final Duration theInitialBackoff) {
      initialBackoff = theInitialBackoff;
    }

    public Duration getMaxBackoff() {
      return maxBackoff;
    }

    public void setMaxBackoff(final Duration theMaxBackoff) {
      maxBackoff = theMaxBackoff;
    }
  }

  /** The PostgreSQL source store, bound from {@code fanout.source}. */
  public static class Source {

    /** The database URL, null when no source connector is configured. */
    private String url;

    /** The database user, null to take it from the URL. */
    private String user;

    /** The database password, null to take it from the URL. */
    private String password;

    public String getUrl() {
      return url;
    }

    public void setUrl(final String theUrl) {
      url = theUrl;
    }

    public String getUser() {
      return user;
    }

    public void setUser(final String theUser) {
      user = theUser;
    }

    public String getPassword() {
      return password;
    }

    public void setPassword(final String thePassword) {
      password = thePassword;
    }
  }

  /** The relay, bound from {@code fanout.relay}. */
  public static class Relay {

    /** The Kafka relay settings. */
    private final Kafka kafka = new Kafka();

    public Kafka getKafka() {
      return kafka;
    }
  }

  /** The Kafka relay, bound from {@code fanout.relay.kafka}. */
  public static class Kafka {

    /** The Kafka bootstrap servers connection string, null when no relay
     * is configured. */
    private String bootstrapServers;

    /** The topic shared by all channels. */
    private String topic = RelayNotifier.DEFAULT_TOPIC;

    /** The prefix for generating unique consumer group IDs per process. */
    private String consumerGroupPrefix = "fanout-";

    /** Bound on broker checks and publish acknowledgements. */
    private Duration requestTimeout = Duration.ofSeconds(5);

    /** How often an idle relay connection checks the brokers. */
    private Duration healthCheckInterval = Duration.ofSeconds(10);

    public String getBootstrapServers() {
      return bootstrapServers;
    }

    public void setBootstrapServers(final String theBootstrapServers) {
      bootstrapServers = theBootstrapServers;
    }

    public String getTopic() {
      return topic;
    }

    public void setTopic(final String theTopic) {
      topic = theTopic;
    }

    public String getConsumerGroupPrefix() {
      return consumerGroupPrefix;
    }

    public void setConsumerGroupPrefix(final String theConsumerGroupPrefix) {
      consumerGroupPrefix = theConsumerGroupPrefix;
    }

    public Duration getRequestTimeout() {
      return requestTimeout;
    }

    public void setRequestTimeout(final Duration theRequestTimeout) {
      requestTimeout = theRequestTimeout;
    }

    public Duration getHealthCheckInterval() {
      return healthCheckInterval;
    }

    public void setHealthCheckInterval(final Duration theInterval) {
      healthCheckInterval = theInterval;
    }
  }
}
