package io.clientforge.generators.java;

import io.clientforge.spec.InvalidSpecException;
import io.clientforge.spec.model.Operation;
import io.clientforge.spec.model.PathItem;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

public class RouteTreeTest {

  private static PathItem withGet() {
    PathItem item = new PathItem();
    item.get = new Operation();
    return item;
  }

  private static Map<String, PathItem> paths(String... urls) {
    Map<String, PathItem> paths = new LinkedHashMap<>();
    for (String url : urls) {
      paths.put(url, withGet());
    }
    return paths;
  }

  @Test
  void shouldBuildSharedIntermediateNodes() {
    RouteTree tree = RouteTree.build(paths("/a/{id}", "/a/{id}/b", "/a/c"));

    PathNode a = tree.root().children().get("a");
    assertThat(tree.root().children()).containsOnlyKeys("a");
    assertThat(a.isEndpoint()).isFalse();
    assertThat(a.children().keySet()).containsExactly("{id}", "c");

    PathNode id = a.children().get("{id}");
    assertThat(id.url()).isEqualTo("/a/{id}");
    assertThat(id.parameter()).isEqualTo("id");
    assertThat(id.children().get("b").url()).isEqualTo("/a/{id}/b");
    assertThat(a.children().get("c").url()).isEqualTo("/a/c");
  }

  @Test
  void shouldKeepDescendantsWhenEndpointArrivesLater() {
    RouteTree tree = RouteTree.build(paths("/a/{id}/b", "/a/{id}"));

    PathNode id = tree.root().children().get("a").children().get("{id}");
    assertThat(id.url()).isEqualTo("/a/{id}");
    assertThat(id.children()).containsOnlyKeys("b");
  }

  @Test
  void shouldKeepFirstSeenChildOrder() {
    RouteTree tree = RouteTree.build(paths("/zebra", "/apple", "/mango/x", "/apple/y"));

    assertThat(tree.root().children().keySet()).containsExactly("zebra", "apple", "mango");
  }

  @Test
  void shouldAttachSlashToRoot() {
    RouteTree tree = RouteTree.build(paths("/", "/a"));

    assertThat(tree.root().url()).isEqualTo("/");
    assertThat(tree.root().hasOperations()).isTrue();
    assertThat(tree.root().children()).containsOnlyKeys("a");
  }

  @Test
  void shouldGiveSyntheticRootTheSlashUrl() {
    RouteTree tree = RouteTree.build(paths("/a"));

    assertThat(tree.root().url()).isEqualTo("/");
    assertThat(tree.root().hasOperations()).isFalse();
  }

  @Test
  void shouldRejectTwoUrlsForOneRoute() {
    assertThatThrownBy(() -> RouteTree.build(paths("/a", "/a/")))
      .isInstanceOf(InvalidSpecException.class)
      .hasMessageContaining("'/a' and '/a/'");
  }

  @Test
  void shouldPrintTreeWithInheritedParameters() {
    RouteTree tree = RouteTree.build(paths("/a/{id}", "/a/{id}/b", "/a/c"));

    assertThat(tree.print()).isEqualTo("""
      /
      \ta/
      \t\t{id}/ *
      \t\t\tb/ [id] *
      \t\tc/ *
      """);
  }

  @Test
  void shouldPrintParametersOfIntermediateNodes() {
    RouteTree tree = RouteTree.build(paths("/users/{user}/repos/{repo}"));

    assertThat(tree.print()).isEqualTo(
      "/\n\tusers/\n\t\t{user}/\n\t\t\trepos/ [user]\n\t\t\t\t{repo}/ [user] *\n");
  }
}
