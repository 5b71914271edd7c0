package ca.gc.cra.rendezvous.validation;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.regex.Pattern;

/**
 * Listen endpoint validation for the signaling server.
 *
 * <p>Accepts {@code host:port} with a hostname, an IPv4 literal or a bracketed IPv6 literal, and splits the
 * result into a {@link HostPort} the transport can bind to.</p>
 */
public final class Net {

  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final int MAX_LABEL_LENGTH    = 63;

  // IPv4 dotted-quad shape; octets are range-checked separately.
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

  private Net() {
    // Utility
  }

  /**
   * Host and port pair produced by {@link #parseHostPort(String)}.
   *
   * @param host hostname or literal, IPv6 without brackets
   * @param port TCP port in {@code [1, 65535]}
   */
  public record HostPort(String host, int port) {
    /**
     * Renders the pair back to {@code host:port}, bracketing IPv6 literals.
     *
     * @return canonical text form
     */
    @Override
    public String toString() {
      return (host.indexOf(':') >= 0 ? '[' + host + ']' : host) + ':' + port;
    }
  }

  /**
   * Tests whether {@code value} is a syntactically valid DNS hostname (labels of alphanumerics and inner hyphens).
   *
   * @param value candidate text; {@code null} yields {@code false}
   * @return {@code true} when every label is well formed
   */
  public static boolean isHostname(String value) {
    if (value == null) {
      return false;
    }
    try {
      validateHostname(value);
      return true;
    } catch (IllegalArgumentException ex) {
      return false;
    }
  }

  /**
   * Parses a host:port string supporting hostnames, IPv4, and bracketed IPv6 literals.
   *
   * @param value candidate endpoint text
   * @return validated endpoint
   * @throws IllegalArgumentException when the host or port is malformed
   */
  public static HostPort parseHostPort(String value) {
    final String sanitized = Strings.requireNonBlank("host:port", value);
    final String host;
    final String portPart;

    if (sanitized.startsWith("[")) {
      final int idx = sanitized.indexOf(']');
      if (idx < 0) {
        throw new IllegalArgumentException("host:port must close IPv6 literal with ']'");
      }
      host = sanitized.substring(1, idx);
      if (idx + 2 > sanitized.length() || sanitized.charAt(idx + 1) != ':') {
        throw new IllegalArgumentException("host:port must include :<port> after IPv6 literal");
      }
      portPart = sanitized.substring(idx + 2);
      validateIpv6(host);
    } else {
      final int lastColon = sanitized.lastIndexOf(':');
      if (lastColon <= 0 || lastColon == sanitized.length() - 1) {
        throw new IllegalArgumentException("host:port must use HOST:PORT format");
      }
      host = sanitized.substring(0, lastColon);
      portPart = sanitized.substring(lastColon + 1);
      if (host.indexOf(':') >= 0) {
        throw new IllegalArgumentException("IPv6 host must be wrapped in [ ]");
      }
      validateHost(host);
    }

    final int port;
    try {
      port = Integer.parseInt(portPart);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("port must be numeric (was " + portPart + ")", ex);
    }
    Numbers.requireRange("port", port, 1, 65535);
    return new HostPort(host, port);
  }

  private static void validateHost(String host) {
    if (IPV4_PATTERN.matcher(host).matches()) {
      validateIpv4Octets(host);
      return;
    }
    validateHostname(host);
  }

  private static void validateHostname(String host) {
    final int len = host.length();
    if (len == 0 || len > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException("invalid hostname length: " + len + " (must be 1.." + MAX_HOSTNAME_LENGTH + ')');
    }
    int start = 0;
    while (true) {
      final int dot = host.indexOf('.', start);
      final int end = (dot == -1) ? len : dot;
      validateLabel(host, start, end);
      if (dot == -1) {
        break;
      }
      start = dot + 1;
      if (start == len) {
        throw new IllegalArgumentException("invalid hostname: empty trailing label");
      }
    }
  }

  private static void validateLabel(String s, int start, int end) {
    final int labelLen = end - start;
    if (labelLen <= 0 || labelLen > MAX_LABEL_LENGTH) {
      throw new IllegalArgumentException("invalid hostname: label length " + labelLen + " (must be 1.." + MAX_LABEL_LENGTH + ")");
    }
    final char first = s.charAt(start);
    final char last  = s.charAt(end - 1);
    if (!isAsciiAlnum(first) || !isAsciiAlnum(last)) {
      throw new IllegalArgumentException("invalid hostname: labels must start/end with alphanumeric");
    }
    for (int i = start + 1; i < end - 1; i++) {
      final char c = s.charAt(i);
      if (!(isAsciiAlnum(c) || c == '-')) {
        throw new IllegalArgumentException("invalid hostname: illegal character '" + c + '\'');
      }
    }
  }

  private static void validateIpv4Octets(String host) {
    for (String part : host.split("\\.")) {
      Numbers.requireRange("IPv4 octet", Integer.parseInt(part), 0, 255);
    }
  }

  private static void validateIpv6(String host) {
    try {
      final InetAddress address = InetAddress.getByName(host);
      if (!(address instanceof Inet6Address)) {
        throw new IllegalArgumentException("invalid IPv6 literal: " + host);
      }
    } catch (UnknownHostException ex) {
      throw new IllegalArgumentException("invalid IPv6 literal: " + host, ex);
    }
  }

  private static boolean isAsciiAlnum(char c) {
    return (c >= 'a' && c <= 'z')
        || (c >= 'A' && c <= 'Z')
        || (c >= '0' && c <= '9');
  }
}
