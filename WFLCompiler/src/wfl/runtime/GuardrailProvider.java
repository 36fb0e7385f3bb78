package wfl.runtime;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Masking and detection for guardrail actions: the builtin {@code pii} and {@code jailbreak}
 * guardrails plus the named regex guardrails of a workflow.
 */
public class GuardrailProvider {
  private static final Logger logger = LoggerFactory.getLogger(GuardrailProvider.class);

  public static final String PII = "pii";
  public static final String JAILBREAK = "jailbreak";

  // Applied in order: a card number contains SSN- and phone-shaped runs.
  private static final ImmutableMap<String, Pattern> PII_PATTERNS =
      ImmutableMap.of(
          "[CREDIT_CARD]", Pattern.compile("\\d{4}[-.\\s]?\\d{4}[-.\\s]?\\d{4}[-.\\s]?\\d{4}"),
          "[SSN]", Pattern.compile("\\d{3}[-.\\s]?\\d{2}[-.\\s]?\\d{4}"),
          "[PHONE]",
              Pattern.compile("(?:\\+?1[-.\\s]?)?(?:\\(?\\d{3}\\)?[-.\\s]?)\\d{3}[-.\\s]?\\d{4}"),
          "[EMAIL]", Pattern.compile("[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}"));

  private static final ImmutableList<Pattern> JAILBREAK_PATTERNS =
      ImmutableList.of(
          Pattern.compile("ignore.*(?:previous|all).*instructions", Pattern.CASE_INSENSITIVE),
          Pattern.compile("(?:you are|act as).*(?:DAN|do anything)", Pattern.CASE_INSENSITIVE),
          Pattern.compile(
              "pretend.*(?:no|without).*(?:restrictions|rules)", Pattern.CASE_INSENSITIVE),
          Pattern.compile(
              "(?:show|reveal|what is).*(?:system|initial).*(?:prompt|instruction)",
              Pattern.CASE_INSENSITIVE),
          Pattern.compile("bypass.*(?:safety|security|restrictions)", Pattern.CASE_INSENSITIVE),
          Pattern.compile("jailbreak", Pattern.CASE_INSENSITIVE),
          Pattern.compile("ignore.*(?:ethics|guidelines|policies)", Pattern.CASE_INSENSITIVE));

  private final Map<String, Pattern> custom = new LinkedHashMap<>();

  public void register(String name, String regex) {
    custom.put(name, Pattern.compile(regex));
  }

  /** Replaces whatever the guardrail detects in {@code text} with a placeholder. */
  public String mask(String guardrail, String text) {
    logger.debug("masking {}", guardrail);
    if (guardrail.equals(PII)) {
      String result = text;
      for (Map.Entry<String, Pattern> pii : PII_PATTERNS.entrySet()) {
        result = pii.getValue().matcher(result).replaceAll(pii.getKey());
      }
      return result;
    }
    Pattern pattern = custom.get(guardrail);
    if (pattern == null) {
      logger.warn("guardrail '{}' cannot mask", guardrail);
      return text;
    }
    return pattern.matcher(text).replaceAll("[" + guardrail.toUpperCase() + "]");
  }

  /** Whether the guardrail detects anything in {@code text}. */
  public boolean check(String guardrail, String text) {
    logger.debug("checking {}", guardrail);
    if (guardrail.equals(JAILBREAK)) {
      for (Pattern pattern : JAILBREAK_PATTERNS) {
        if (pattern.matcher(text).find()) {
          logger.warn("jailbreak attempt detected");
          return true;
        }
      }
      return false;
    }
    if (guardrail.equals(PII)) {
      return PII_PATTERNS.values().stream().anyMatch(p -> p.matcher(text).find());
    }
    Pattern pattern = custom.get(guardrail);
    if (pattern == null) {
      logger.warn("guardrail '{}' cannot check", guardrail);
      return false;
    }
    return pattern.matcher(text).find();
  }
}
