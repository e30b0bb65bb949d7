package com.aino.util;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.TimeUnit;

/** Utility class for formatting log lines with ANSI colors. */
public class LogUtil {
  public static final String RESET = "\033[0m";
  public static final String RED = "\033[0;31m";
  public static final String GREEN = "\033[0;32m";
  public static final String YELLOW = "\033[0;33m";
  public static final String BLUE_BOLD = "\033[1;34m";
  public static final String CYAN = "\033[0;36m";
  public static final String CYAN_BOLD = "\033[1;36m";
  public static final String WHITE = "\033[0;37m";

  private static final DateTimeFormatter TIME_FORMATTER =
      DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

  private LogUtil() {}

  public static String info(String message) {
    return formatLog("INFO", GREEN, message);
  }

  public static String warn(String message) {
    return formatLog("WARN", YELLOW, message);
  }

  public static String error(String message) {
    return formatLog("ERROR", RED, message);
  }

  /**
   * Wraps text with the specified color and resets it after
   *
   * @param text the text to color
   * @param color the ANSI color code
   * @return the colored text
   */
  public static String colored(String text, String color) {
    return color + text + RESET;
  }

  /**
   * Formats a request duration, in microseconds below one millisecond and in milliseconds above.
   *
   * @param nanos the duration in nanoseconds
   * @return e.g. "850μs" or "12ms"
   */
  public static String duration(long nanos) {
    long micros = TimeUnit.NANOSECONDS.toMicros(nanos);
    if (micros > 1_000) {
      return TimeUnit.NANOSECONDS.toMillis(nanos) + "ms";
    }
    return micros + "μs";
  }

  /**
   * Formats a completed request, colored by status class.
   *
   * @param method the request method
   * @param path the request path
   * @param status the response status
   * @param nanos the time taken in nanoseconds
   * @return the formatted log message
   */
  public static String request(String method, String path, int status, long nanos) {
    String statusColor = status >= 500 ? RED : status >= 400 ? YELLOW : GREEN;
    return info(
        colored(method + " " + path, BLUE_BOLD)
            + " "
            + colored(String.valueOf(status), statusColor)
            + " complete in "
            + colored(duration(nanos), CYAN));
  }

  private static String formatLog(String level, String color, String message) {
    String time = LocalDateTime.now().format(TIME_FORMATTER);

    // Format: [TIME] [LEVEL] message
    return colored("[" + time + "]", WHITE) + " " + colored("[" + level + "]", color) + " " + message;
  }
}
