package org.waabox.fanout.listener;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Spring Boot application entry point for the notification listener.
 *
 * <p>Runs as a single process next to the database: it listens on every
 * change channel and republishes each notification on the relay topic, so
 * any number of service processes can consume changes without holding a
 * database connection each. SIGTERM and SIGINT close the context, which
 * stops the listener gracefully.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@SpringBootApplication
public class NotifyListenerApplication {

  /** Launches the Spring Boot application.
   *
   * @param args the command-line arguments
   */
  public static void main(final String[] args) {
    SpringApplication.run(NotifyListenerApplication.class, args);
  }
}
