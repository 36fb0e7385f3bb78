package wfl.runtime;

import static com.google.common.truth.Truth.assertThat;

import java.util.Locale;

import org.junit.jupiter.api.Test;

public class EscalationConditionTest {

  @Test
  public void operators() {
    assertThat(new EscalationCondition("==", "DONE").matches("DONE")).isTrue();
    assertThat(new EscalationCondition("==", "DONE").matches("done")).isFalse();
    assertThat(new EscalationCondition("!=", "OK").matches("FAILED")).isTrue();
    assertThat(new EscalationCondition("contains", "UNSURE").matches("I am UNSURE here"))
        .isTrue();
    assertThat(new EscalationCondition("contains", "UNSURE").matches("unsure")).isFalse();
  }

  @Test
  public void normalizedMatchIgnoresEmphasisAndCase() {
    EscalationCondition drifted = new EscalationCondition("~", "drifted");

    assertThat(drifted.matches("**Drifted.**")).isTrue();
    assertThat(drifted.matches("  DRIFTED!  ")).isTrue();
    assertThat(drifted.matches("not drifted")).isFalse();
  }

  @Test
  public void normalizedMatchIgnoresTheDefaultLocale() {
    Locale previous = Locale.getDefault();
    Locale.setDefault(new Locale("tr", "TR"));
    try {
      assertThat(new EscalationCondition("~", "drifting").matches("**DRIFTING.**")).isTrue();
    } finally {
      Locale.setDefault(previous);
    }
  }

  @Test
  public void normalizeCollapsesWhitespace() {
    assertThat(EscalationCondition.normalize("  _Needs\t\tHuman_  review. "))
        .isEqualTo("needs human review");
  }

  @Test
  public void describesItself() {
    assertThat(new EscalationCondition("contains", "HELP").toString())
        .isEqualTo("contains \"HELP\"");
  }
}
