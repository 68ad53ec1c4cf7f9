package ca.gc.cra.sbuild.validation;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * URL syntax checks for descriptor fields such as {@code homepage} and {@code src_url}.
 *
 * <p>A URL is accepted when it parses as an absolute URI with a scheme and an authority whose host is a
 * valid hostname, IPv4 address or bracketed IPv6 literal. No network lookups are made for hostnames.</p>
 */
public final class Urls {

  // RFC-conservative bounds
  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final int MAX_LABEL_LENGTH = 63;

  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");
  private static final Pattern SCHEME_PATTERN = Pattern.compile("\\A[a-z][a-z0-9+.-]*\\z");

  private Urls() {
    // Utility
  }

  /**
   * Checks URL syntax.
   *
   * @param value candidate URL
   * @return {@code true} when the URL is syntactically valid
   */
  public static boolean isValid(String value) {
    if (value == null || value.isBlank() || Strings.containsControl(value)) {
      return false;
    }
    final URI uri;
    try {
      uri = new URI(value.trim());
    } catch (URISyntaxException ex) {
      return false;
    }
    String scheme = uri.getScheme();
    if (scheme == null || !SCHEME_PATTERN.matcher(scheme.toLowerCase(Locale.ROOT)).matches()) {
      return false;
    }
    String host = uri.getHost();
    if (host == null || host.isEmpty()) {
      return false;
    }
    return isValidHost(host);
  }

  private static boolean isValidHost(String host) {
    if (host.startsWith("[") && host.endsWith("]")) {
      return isIpv6(host.substring(1, host.length() - 1));
    }
    if (IPV4_PATTERN.matcher(host).matches()) {
      return isIpv4(host);
    }
    return isHostname(host);
  }

  /** Deterministic hostname validator (ASCII/Punycode). */
  private static boolean isHostname(String host) {
    final int len = host.length();
    if (len == 0 || len > MAX_HOSTNAME_LENGTH) {
      return false;
    }
    int start = 0;
    while (true) {
      final int dot = host.indexOf('.', start);
      final int end = (dot == -1) ? len : dot;
      if (!isLabel(host, start, end)) {
        return false;
      }
      if (dot == -1) {
        return true;
      }
      start = dot + 1;
      if (start == len) {
        // trailing dot denotes the DNS root
        return true;
      }
    }
  }

  /**
   * Validates a single label [start,end): length 1..63, alnum at both ends, alnum or '-' inside.
   */
  private static boolean isLabel(String s, int start, int end) {
    final int labelLen = end - start;
    if (labelLen <= 0 || labelLen > MAX_LABEL_LENGTH) {
      return false;
    }
    if (!isAsciiAlnum(s.charAt(start)) || !isAsciiAlnum(s.charAt(end - 1))) {
      return false;
    }
    for (int i = start + 1; i < end - 1; i++) {
      final char c = s.charAt(i);
      if (!(isAsciiAlnum(c) || c == '-')) {
        return false;
      }
    }
    return true;
  }

  private static boolean isIpv4(String host) {
    for (String part : host.split("\\.")) {
      if (Integer.parseInt(part) > 255) {
        return false;
      }
    }
    return true;
  }

  /** IPv6 literals only; the pattern guard keeps {@link InetAddress} from resolving names. */
  private static boolean isIpv6(String literal) {
    if (literal.isEmpty() || literal.indexOf(':') < 0) {
      return false;
    }
    try {
      return InetAddress.getByName(literal) instanceof Inet6Address;
    } catch (UnknownHostException ex) {
      return false;
    }
  }

  private static boolean isAsciiAlnum(char c) {
    return (c >= 'a' && c <= 'z')
        || (c >= 'A' && c <= 'Z')
        || (c >= '0' && c <= '9');
  }
}
