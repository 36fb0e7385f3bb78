package wfl.runtime;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

public class OpsTest {

  @Test
  public void truthiness() {
    assertThat(Ops.truthy(null)).isFalse();
    assertThat(Ops.truthy("")).isFalse();
    assertThat(Ops.truthy(0L)).isFalse();
    assertThat(Ops.truthy(0.0)).isFalse();
    assertThat(Ops.truthy(ImmutableList.of())).isFalse();
    assertThat(Ops.truthy(ImmutableMap.of())).isFalse();
    assertThat(Ops.truthy("no")).isTrue();
    assertThat(Ops.truthy(2L)).isTrue();
    assertThat(Ops.truthy(ImmutableList.of(false))).isTrue();
  }

  @Test
  public void numbersCompareByValue() throws TypeMismatchException {
    assertThat(Ops.equal(1L, 1.0)).isTrue();
    assertThat(Ops.equal(1L, "1")).isFalse();
    assertThat(Ops.equal(null, null)).isTrue();
    assertThat(Ops.compare("<", 2L, 2.5)).isTrue();
    assertThat(Ops.compare(">=", "b", "a")).isTrue();
  }

  @Test
  public void comparingMixedTypesFails() {
    TypeMismatchException ex =
        assertThrows(TypeMismatchException.class, () -> Ops.compare("<", 1L, "2"));
    assertThat(ex).hasMessageThat().isEqualTo("cannot compare int < string");
  }

  @Test
  public void arithmetic() throws TypeMismatchException {
    assertThat(Ops.add(2L, 3L)).isEqualTo(5L);
    assertThat(Ops.add(2L, 0.5)).isEqualTo(2.5);
    assertThat(Ops.add("n=", 3L)).isEqualTo("n=3");
    assertThat(Ops.add(ImmutableList.of(1L), ImmutableList.of(2L)))
        .isEqualTo(ImmutableList.of(1L, 2L));
    assertThat(Ops.subtract(5L, 7L)).isEqualTo(-2L);
    assertThat(Ops.multiply(3L, 1.5)).isEqualTo(4.5);
    assertThat(Ops.negate(4L)).isEqualTo(-4L);
  }

  @Test
  public void divisionIsAlwaysFloatingPoint() throws TypeMismatchException {
    assertThat(Ops.divide(6L, 3L)).isEqualTo(2.0);
    assertThat(Ops.divide(1L, 4L)).isEqualTo(0.25);
  }

  @Test
  public void arithmeticErrors() {
    assertThat(assertThrows(TypeMismatchException.class, () -> Ops.divide(1L, 0L)))
        .hasMessageThat()
        .isEqualTo("division by zero");
    assertThat(assertThrows(TypeMismatchException.class, () -> Ops.subtract("a", 1L)))
        .hasMessageThat()
        .isEqualTo("unsupported operand types for -: string and int");
    assertThrows(TypeMismatchException.class, () -> Ops.negate("x"));
  }

  @Test
  public void contains() {
    assertThat(Ops.contains("hello world", "world")).isTrue();
    assertThat(Ops.contains(ImmutableList.of(1L, 2L), 2.0)).isTrue();
    assertThat(Ops.contains(ImmutableMap.of("k", 1L), "k")).isTrue();
    assertThat(Ops.contains(null, "x")).isFalse();
  }

  @Test
  public void propertyAccessParsesJsonStrings() {
    Map<String, Object> value = Ops.map("user", Ops.map("name", "ada"));

    assertThat(Ops.property(value, "user", "name")).isEqualTo("ada");
    assertThat(Ops.property(value, "user", "missing")).isNull();
    assertThat(Ops.property("{\"score\": 7}", "score")).isEqualTo(7L);
    assertThat(Ops.property("{not json", "score")).isNull();
    assertThat(Ops.property("plain", "x")).isNull();
  }

  @Test
  public void filterKeepsOrder() throws TypeMismatchException {
    List<Object> issues =
        Ops.list(
            Ops.map("id", 1L, "severity", 5L),
            Ops.map("id", 2L, "severity", 1L),
            Ops.map("id", 3L),
            Ops.map("id", 4L, "severity", 3L));

    List<Object> kept = Ops.filter(issues, ">=", 3L, "severity");

    assertThat(kept).hasSize(2);
    assertThat(Ops.property(kept.get(0), "id")).isEqualTo(1L);
    assertThat(Ops.property(kept.get(1), "id")).isEqualTo(4L);
    assertThat(Ops.filter(issues, "==", null, "severity")).hasSize(1);
  }

  @Test
  public void iteration() throws TypeMismatchException {
    assertThat(Ops.iterable("[1, 2]")).containsExactly(1L, 2L).inOrder();
    assertThat(Ops.iterable(Ops.map("a", "x", "b", "y"))).containsExactly("x", "y").inOrder();
    assertThrows(TypeMismatchException.class, () -> Ops.iterable(5L));
  }

  @Test
  public void stringify() {
    assertThat(Ops.stringify(null)).isEmpty();
    assertThat(Ops.stringify(2.5)).isEqualTo("2.5");
    assertThat(Ops.stringify(Ops.map("a", Ops.list(1L, "b")))).isEqualTo("{\"a\":[1,\"b\"]}");
    assertThat(Ops.join("review", 3L, null, Ops.list(1L))).isEqualTo("review 3  [1]");
  }

  @Test
  public void normalizedEquality() throws TypeMismatchException {
    assertThat(Ops.normalizedEquals("**Drifted.**", "drifted")).isTrue();
    assertThat(Ops.test("~", "  Yes  ", "yes!")).isTrue();
  }
}
