package io.github.nabilcarel.gateway.util;

import java.util.regex.Pattern;
import lombok.experimental.UtilityClass;

@UtilityClass
public class Patterns {
  public static final Pattern INDEX_PATTERN = Pattern.compile("\\[(\\d+)\\]");
  public static final Pattern PREVIOUS_REFERENCE_PATTERN = Pattern.compile("^\\$prev\\.([^.\\[]+)(.*)$");
  public static final Pattern CONTEXT_REFERENCE_PATTERN = Pattern.compile("^\\$context\\.(.+)$");
  public static final Pattern MAX_AGE_PATTERN = Pattern.compile("(?:^|[,\\s])max-age\\s*=\\s*\"?(\\d+)\"?", Pattern.CASE_INSENSITIVE);
  public static final Pattern SOAP_ENVELOPE_PATTERN = Pattern.compile("<(?:[\\w-]+:)?Envelope[\\s>]", Pattern.CASE_INSENSITIVE);
}
