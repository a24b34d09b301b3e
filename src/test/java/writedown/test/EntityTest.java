// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package writedown.test;

import java.util.List;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import writedown.ast.Node;
import writedown.ast.Payload;
import writedown.parser.Parser;

final class EntityTest {
    @Test
    void location() {
        final var document = new Parser().parseString("@location Somewhere");
        Assertions.assertThat(document.children())
            .extracting(Node::payload)
            .containsExactly(new Payload.Location("Somewhere", List.of()));
    }

    @Test
    void locationWithGeoPath() {
        final var document = new Parser().parseString("@location Café Rouge, Paris , France");
        final var location = document.children().get(0).payload(Payload.Location.class);
        Assertions.assertThat(location.name()).isEqualTo("Café Rouge");
        Assertions.assertThat(location.geoPaths()).containsExactly("Paris", "France");
        Assertions.assertThat(location.path()).isEqualTo("Café Rouge, Paris, France");
    }

    @Test
    void locationTakesNoNotes() {
        final var document = new Parser().parseString("@location Home\nShe came home.");
        Assertions.assertThat(document.children())
            .extracting(Node::toString)
            .containsExactly("Location: Home", "She came home.");
    }

    @Test
    void characterWithNotes() {
        final var document = new Parser().parseString("""
            @character Elizabeth Bennet, Lizzy, Eliza
            Second daughter.
            Quick-witted.
            @chapter One
            text""");
        Assertions.assertThat(document.children()).hasSize(2);
        final var character = document.children().get(0).payload(Payload.Character.class);
        Assertions.assertThat(character.name()).isEqualTo("Elizabeth Bennet");
        Assertions.assertThat(character.nameForms()).containsExactly("Lizzy", "Eliza");
        Assertions.assertThat(character.notes()).isEqualTo("Second daughter.\nQuick-witted.");
        Assertions.assertThat(document.children().get(1).children())
            .extracting(Node::toString)
            .containsExactly("text");
    }

    @Test
    void characterWithoutNotes() {
        final var document = new Parser().parseString("@character Darcy\n@todo describe him");
        Assertions.assertThat(document.children())
            .extracting(Node::payload)
            .containsExactly(new Payload.Character("Darcy", List.of(), ""), new Payload.Todo("describe him"));
    }

    @Test
    void placeWithNotes() {
        final var document = new Parser().parseString("@place Pemberley, Derbyshire\nA large estate.");
        Assertions.assertThat(document.children())
            .extracting(Node::payload)
            .containsExactly(new Payload.Place("Pemberley", List.of("Derbyshire"), "A large estate."));
    }

    @Test
    void notesStayInsideScene() {
        final var document = new Parser().parseString("@scene\n@place Longbourn\nnotes\n@scene\nprose");
        final var scenes = document.find(Payload.Scene.class);
        Assertions.assertThat(scenes).hasSize(2);
        Assertions.assertThat(scenes.get(0).children())
            .extracting(Node::payload)
            .containsExactly(new Payload.Place("Longbourn", List.of(), "notes"));
        Assertions.assertThat(scenes.get(1).children())
            .extracting(Node::toString)
            .containsExactly("prose");
    }
}
