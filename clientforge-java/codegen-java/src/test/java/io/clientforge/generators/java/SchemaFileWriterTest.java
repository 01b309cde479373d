package io.clientforge.generators.java;

import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.JavaFile;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

public class SchemaFileWriterTest {

  private static final ClassName PLAYER = ClassName.get("com.example.league.schemas", "Player");

  private static SchemaDefinition team() {
    return new SchemaDefinition(
      "Team",
      ClassName.get("com.example.league.schemas", "Team"),
      "A team in the league",
      List.of(
        new SchemaField("id", "id", ResolvedType.of(Long.class), false, null),
        new SchemaField("team_name", "teamName", ResolvedType.of(String.class), true, "Display name"),
        new SchemaField("players", "players", ResolvedType.listOf(ResolvedType.of(PLAYER)), false, null)
      ),
      "#/components/schemas/Team");
  }

  @Test
  void shouldRenderClassInSchemasPackage() {
    JavaFile file = new SchemaFileWriter().render(team());

    assertThat(file.packageName).isEqualTo("com.example.league.schemas");
    assertThat(file.typeSpec.name).isEqualTo("Team");

    String source = file.toString();
    assertThat(source).startsWith("package com.example.league.schemas;");
    assertThat(source).contains("@JsonIgnoreProperties(ignoreUnknown = true)");
    assertThat(source).contains("@JsonInclude(JsonInclude.Include.NON_NULL)");
    assertThat(source).contains("public class Team {");
    assertThat(source).contains("A team in the league");
  }

  @Test
  void shouldMapEveryPropertyToAnnotatedField() {
    String source = new SchemaFileWriter().render(team()).toString();

    assertThat(source).contains("private Long id;");
    assertThat(source).contains("private String teamName;");
    assertThat(source).contains("private List<Player> players;");
    assertThat(source).containsPattern("value = \"team_name\",\\s+required = true");
    assertThat(source).containsPattern("value = \"id\",\\s+required = false");
    assertThat(source).contains("Display name");
    assertThat(source).doesNotContain("java.lang.");
  }

  @Test
  void shouldGenerateAccessorsAndValueMethods() {
    String source = new SchemaFileWriter().render(team()).toString();

    assertThat(source).contains("public Team() {");
    assertThat(source).contains("public String getTeamName() {");
    assertThat(source).contains("public void setTeamName(String teamName) {");
    assertThat(source).contains("this.teamName = teamName;");
    assertThat(source).contains("public List<Player> getPlayers() {");
    assertThat(source).contains("if (!(o instanceof Team)) return false;");
    assertThat(source).contains("return Objects.hash(id, teamName, players);");
    assertThat(source).contains("return \"Team{\" + \"id=\" + id + \", teamName=\" + teamName");
  }

  @Test
  void shouldRenderOneFilePerDefinitionInOrder() {
    SchemaDefinition player = new SchemaDefinition("Player", PLAYER, null,
      List.of(new SchemaField("name", "name", ResolvedType.of(String.class), false, null)),
      "#/components/schemas/Player");

    List<JavaFile> files = new SchemaFileWriter().render(List.of(team(), player));

    assertThat(files).extracting(f -> f.typeSpec.name).containsExactly("Team", "Player");
    assertThat(files.get(1).toString()).doesNotContain("/**");
  }
}
