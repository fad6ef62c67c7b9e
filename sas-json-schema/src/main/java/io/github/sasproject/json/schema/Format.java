package io.github.sasproject.json.schema;

import java.net.InetAddress;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/// The `format` values this engine asserts; any other name is an annotation only
public enum Format implements FormatValidator {
  UUID(s -> Shapes.UUID.matcher(s).matches()),
  EMAIL(s -> Shapes.EMAIL.matcher(s).matches() && !s.contains("..")),
  IPV4(Format::isIpv4),
  IPV6(Format::isIpv6),
  URI(s -> parsesAsUri(s, true)),
  URI_REFERENCE(s -> parsesAsUri(s, false)),
  HOSTNAME(Format::isHostname),
  DATE(s -> parses(s, LocalDate::parse)),
  TIME(s -> parses(s, OffsetTime::parse) || parses(s, LocalTime::parse)),
  // RFC 3339 date-time requires an offset
  DATE_TIME(s -> parses(s, OffsetDateTime::parse)),
  REGEX(Format::compiles);

  private static final Map<String, Format> BY_NAME = Arrays.stream(values())
      .collect(Collectors.toUnmodifiableMap(FormatValidator::formatName, Function.identity()));

  private final Predicate<String> check;

  Format(Predicate<String> check) {
    this.check = check;
  }

  @Override
  public boolean test(String s) {
    return check.test(s);
  }

  /// Validator for a `format` value (case-insensitive), or null when the name is not asserted
  static FormatValidator byName(String name) {
    return BY_NAME.get(name.toLowerCase(Locale.ROOT));
  }

  private static boolean parses(String s, Function<String, ?> parser) {
    try {
      parser.apply(s);
      return true;
    } catch (DateTimeParseException e) {
      return false;
    }
  }

  private static boolean parsesAsUri(String s, boolean absolute) {
    try {
      java.net.URI uri = new java.net.URI(s);
      return !absolute || uri.isAbsolute();
    } catch (URISyntaxException e) {
      return false;
    }
  }

  private static boolean isIpv4(String s) {
    String[] octets = s.split("\\.", -1);
    if (octets.length != 4) {
      return false;
    }
    for (String octet : octets) {
      boolean digits = !octet.isEmpty() && octet.length() <= 3 && octet.chars().allMatch(c -> c >= '0' && c <= '9');
      // No leading zeros apart from "0" itself
      if (!digits || (octet.length() > 1 && octet.charAt(0) == '0') || Integer.parseInt(octet) > 255) {
        return false;
      }
    }
    return true;
  }

  private static boolean isIpv6(String s) {
    // Restricting to literal characters keeps InetAddress from doing a DNS lookup
    if (s.indexOf(':') < 0 || !Shapes.IPV6_CHARS.matcher(s).matches()) {
      return false;
    }
    try {
      InetAddress.getByName(s);
      return true;
    } catch (UnknownHostException e) {
      return false;
    }
  }

  private static boolean isHostname(String s) {
    if (s.isEmpty() || s.length() > 255) {
      return false;
    }
    return Arrays.stream(s.split("\\.", -1)).allMatch(label -> Shapes.HOST_LABEL.matcher(label).matches());
  }

  private static boolean compiles(String s) {
    try {
      Pattern.compile(s);
      return true;
    } catch (PatternSyntaxException e) {
      return false;
    }
  }

  /// Initialised on first use by a constant's check, after every constant exists
  private static final class Shapes {
    static final Pattern UUID =
        Pattern.compile("[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");
    static final Pattern EMAIL = Pattern.compile("[^@\\s]+@[^@\\s]+\\.[^@\\s]+");
    static final Pattern HOST_LABEL = Pattern.compile("[a-zA-Z0-9](?:[a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?");
    static final Pattern IPV6_CHARS = Pattern.compile("[0-9a-fA-F:.]+");
  }
}
