package wfl.runtime;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;

public class AgentHierarchyTest {

  private final Map<String, AgentSpec> specs = new HashMap<>();
  private final AgentHierarchy hierarchy =
      new AgentHierarchy(name -> Optional.ofNullable(specs.get(name)));

  private AgentSpec.Builder agent(String name) {
    return AgentSpec.builder(name).setInstruction("p");
  }

  private void define(AgentSpec.Builder builder) {
    AgentSpec spec = builder.build();
    specs.put(spec.name(), spec);
  }

  @Test
  public void buildsChildren() throws UndefinedReferenceException {
    define(agent("lead").addDelegate("writer").addUse("search"));
    define(agent("writer"));
    define(agent("search"));

    AgentInstance lead = hierarchy.instance("lead");

    assertThat(lead.subAgents()).hasSize(1);
    assertThat(lead.subAgents().get(0).name()).isEqualTo("writer");
    assertThat(lead.toolAgents().get(0).name()).isEqualTo("search");
    assertThat(hierarchy.instance("lead")).isSameInstanceAs(lead);
  }

  @Test
  public void undefinedRootFails() {
    assertThrows(UndefinedReferenceException.class, () -> hierarchy.instance("ghost"));
  }

  @Test
  public void undefinedAndCircularChildrenAreSkipped() throws UndefinedReferenceException {
    define(agent("a").addDelegate("b").addDelegate("ghost"));
    define(agent("b").addDelegate("a"));

    AgentInstance a = hierarchy.instance("a");

    assertThat(a.subAgents()).hasSize(1);
    assertThat(a.subAgents().get(0).subAgents()).isEmpty();
  }

  @Test
  public void closesChildrenBeforeParents() throws UndefinedReferenceException {
    define(agent("a").addDelegate("b").addUse("c"));
    define(agent("b").addDelegate("d"));
    define(agent("c"));
    define(agent("d"));
    define(agent("e"));

    AgentInstance a = hierarchy.instance("a");
    hierarchy.instance("e");

    assertThat(hierarchy.close()).containsExactly("d", "b", "c", "a", "e").inOrder();
    assertThat(a.isClosed()).isTrue();
    assertThat(hierarchy.close()).isEmpty();
    assertThrows(IllegalStateException.class, () -> hierarchy.instance("a"));
  }
}
