package io.clientforge.spec;

import io.clientforge.spec.model.Components;
import io.clientforge.spec.model.OpenApiDocument;
import io.clientforge.spec.model.Parameter;
import io.clientforge.spec.model.RefOr;
import io.clientforge.spec.model.Schema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;

import static org.assertj.core.api.Assertions.*;

public class ReferenceResolverTest {

  private OpenApiDocument api;
  private ReferenceResolver resolver;
  private Schema team;

  @BeforeEach
  void setUp() {
    team = new Schema();
    team.type = "object";

    api = new OpenApiDocument();
    api.components = new Components();
    api.components.schemas = new LinkedHashMap<>();
    api.components.schemas.put("team", RefOr.of(team));
    api.components.schemas.put("team_alias", RefOr.ref("#/components/schemas/team"));
    api.components.schemas.put("loop_a", RefOr.ref("#/components/schemas/loop_b"));
    api.components.schemas.put("loop_b", RefOr.ref("#/components/schemas/loop_a"));
    api.components.schemas.put("a/b", RefOr.of(new Schema()));

    resolver = new ReferenceResolver(api);
  }

  @Test
  void shouldReturnInlineValueWithContextName() {
    Schema inline = new Schema();

    ReferenceResolver.Resolved<Schema> resolved = resolver.resolve(RefOr.of(inline), Schema.class, "GetResponse");

    assertThat(resolved.name()).isEqualTo("GetResponse");
    assertThat(resolved.get()).isSameAs(inline);
  }

  @Test
  void shouldResolveComponentAndInferTypeName() {
    ReferenceResolver.Resolved<Schema> resolved =
        resolver.resolve(RefOr.ref("#/components/schemas/team"), Schema.class, null);

    assertThat(resolved.name()).isEqualTo("Team");
    assertThat(resolved.get()).isSameAs(team);
  }

  @Test
  void shouldFollowOnlyOneHop() {
    ReferenceResolver.Resolved<Schema> resolved =
        resolver.resolve(RefOr.ref("#/components/schemas/team_alias"), Schema.class, null);

    assertThat(resolved.name()).isEqualTo("TeamAlias");
    assertThat(resolved.value()).isEqualTo(RefOr.ref("#/components/schemas/team"));
    assertThatThrownBy(resolved::get)
      .isInstanceOf(UnresolvableReferenceException.class)
      .hasMessageContaining("chained reference");
  }

  @Test
  void shouldFollowChainWhenAskedAndReportLastName() {
    ReferenceResolver.Resolved<Schema> resolved =
        resolver.resolveFully(RefOr.ref("#/components/schemas/team_alias"), Schema.class, null);

    assertThat(resolved.name()).isEqualTo("Team");
    assertThat(resolved.get()).isSameAs(team);
  }

  @Test
  void shouldDetectCircularChain() {
    assertThatThrownBy(() -> resolver.resolveFully(RefOr.ref("#/components/schemas/loop_a"), Schema.class, null))
      .isInstanceOf(UnresolvableReferenceException.class)
      .hasMessageContaining("circular reference chain");
  }

  @Test
  void shouldUnescapePointerTokens() {
    ReferenceResolver.Resolved<Schema> resolved =
        resolver.resolve(RefOr.ref("#/components/schemas/a~1b"), Schema.class, null);

    assertThat(resolved.name()).isEqualTo("AB");
  }

  @Test
  void shouldRejectMissingKey() {
    assertThatThrownBy(() -> resolver.resolve(RefOr.ref("#/components/schemas/Player"), Schema.class, null))
      .isInstanceOf(UnresolvableReferenceException.class)
      .hasMessageContaining("no entry 'Player' in 'schemas'")
      .extracting("pointer").isEqualTo("#/components/schemas/Player");
  }

  @Test
  void shouldRejectUnknownSection() {
    assertThatThrownBy(() -> resolver.resolve(RefOr.ref("#/components/widgets/team"), Schema.class, null))
      .isInstanceOf(UnresolvableReferenceException.class)
      .hasMessageContaining("unknown components section 'widgets'");
  }

  @Test
  void shouldRejectPointerIntoWrongSection() {
    assertThatThrownBy(() -> resolver.resolve(RefOr.ref("#/components/schemas/team"), Parameter.class, null))
      .isInstanceOf(UnresolvableReferenceException.class)
      .hasMessageContaining("expected a Parameter");
  }

  @Test
  void shouldRejectUndeclaredSection() {
    assertThatThrownBy(() -> resolver.resolve(RefOr.ref("#/components/parameters/limit"), Parameter.class, null))
      .isInstanceOf(UnresolvableReferenceException.class)
      .hasMessageContaining("no entry 'limit'");
  }

  @Test
  void shouldRejectNonLocalAndMalformedPointers() {
    assertThatThrownBy(() -> resolver.resolve(RefOr.ref("other.json#/components/schemas/team"), Schema.class, null))
      .isInstanceOf(UnresolvableReferenceException.class)
      .hasMessageContaining("only local");
    assertThatThrownBy(() -> resolver.resolve(RefOr.ref("#/components/schemas"), Schema.class, null))
      .isInstanceOf(UnresolvableReferenceException.class)
      .hasMessageContaining("expected '#/components/<section>/<name>'");
  }

  @Test
  void shouldRejectDocumentWithoutComponents() {
    ReferenceResolver bare = new ReferenceResolver(new OpenApiDocument());

    assertThatThrownBy(() -> bare.resolve(RefOr.ref("#/components/schemas/team"), Schema.class, null))
      .isInstanceOf(UnresolvableReferenceException.class)
      .hasMessageContaining("no components");
  }
}
