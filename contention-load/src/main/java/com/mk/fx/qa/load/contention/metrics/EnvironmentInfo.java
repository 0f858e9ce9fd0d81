package com.mk.fx.qa.load.contention.metrics;

import java.net.InetAddress;
import java.net.UnknownHostException;

/** Host and trigger information stamped on every report. */
public final class EnvironmentInfo {

  private EnvironmentInfo() {
    // Prevent instantiation
  }

  /** Host name from the environment, then from DNS, else {@code "unknown"}. */
  public static String host() {
    String env = firstNonBlank(System.getenv("HOSTNAME"), System.getenv("COMPUTERNAME"), null);
    if (env != null) return env;
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      return "unknown";
    }
  }

  public static String triggeredBy() {
    return firstNonBlank(System.getenv("TRIGGERED_BY"), System.getProperty("user.name"), "unknown");
  }

  private static String firstNonBlank(String a, String b, String def) {
    if (a != null && !a.isBlank()) return a;
    if (b != null && !b.isBlank()) return b;
    return def;
  }
}
